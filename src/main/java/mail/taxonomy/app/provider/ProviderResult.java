package mail.taxonomy.app.provider;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or the kind of failure a provider call ended with.
 * Expected failure modes travel as values; exceptions are left for programming errors.
 */
public final class ProviderResult<T> {
    private final T value;
    private final ProviderErrorKind errorKind;
    private final String message;

    private ProviderResult(T value, ProviderErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> ProviderResult<T> ok(T value) {
        return new ProviderResult<>(value, null, null);
    }

    public static <T> ProviderResult<T> failure(ProviderErrorKind kind, String message) {
        return new ProviderResult<>(null, Objects.requireNonNull(kind), message);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public T getValue() {
        if (!isOk()) {
            throw new IllegalStateException("No value on failed provider result: " + errorKind + " " + message);
        }
        return value;
    }

    public ProviderErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public <R> ProviderResult<R> map(Function<T, R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(errorKind, message);
    }

    public <R> ProviderResult<R> castFailure() {
        if (isOk()) {
            throw new IllegalStateException("Result is not a failure");
        }
        return failure(errorKind, message);
    }

    @Override
    public String toString() {
        return isOk() ? "ProviderResult{ok=" + value + "}" : "ProviderResult{" + errorKind + ": " + message + "}";
    }
}
