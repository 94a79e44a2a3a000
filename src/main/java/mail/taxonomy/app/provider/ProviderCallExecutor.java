package mail.taxonomy.app.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a single remote call with a per-attempt timeout and retries transient failures.
 * A timed-out attempt is cancelled (interrupted) and counts as transient.
 */
@Slf4j
public class ProviderCallExecutor {
    private final AsyncTaskExecutor callExecutor;

    public ProviderCallExecutor(AsyncTaskExecutor callExecutor) {
        this.callExecutor = callExecutor;
    }

    public <T> ProviderResult<T> execute(String operation,
                                         Callable<T> call,
                                         RetryPolicy policy,
                                         Duration timeout,
                                         Function<Exception, ProviderErrorKind> classifier) {
        ProviderResult<T> last = null;
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            last = attempt(operation, call, timeout, classifier);
            if (last.isOk() || last.getErrorKind() != ProviderErrorKind.TRANSIENT) {
                return last;
            }
            if (attempt < policy.getMaxAttempts()) {
                Duration delay = policy.delayAfter(attempt);
                log.warn("{} failed on attempt {}/{} ({}), retrying in {} ms",
                        operation, attempt, policy.getMaxAttempts(), last.getMessage(), delay.toMillis());
                if (!sleep(delay)) {
                    return ProviderResult.failure(ProviderErrorKind.TRANSIENT, operation + " interrupted during backoff");
                }
            }
        }
        log.warn("{} gave up after {} attempts: {}", operation, policy.getMaxAttempts(), last.getMessage());
        return last;
    }

    private <T> ProviderResult<T> attempt(String operation,
                                          Callable<T> call,
                                          Duration timeout,
                                          Function<Exception, ProviderErrorKind> classifier) {
        Future<T> future;
        try {
            future = callExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            // Call pool saturated; back off like any other transient failure
            return ProviderResult.failure(ProviderErrorKind.TRANSIENT, operation + " rejected, call pool is saturated");
        }
        try {
            return ProviderResult.ok(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProviderResult.failure(ProviderErrorKind.TRANSIENT,
                    operation + " timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProviderResult.failure(ProviderErrorKind.TRANSIENT, operation + " interrupted");
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            ProviderErrorKind kind = classifier.apply(cause);
            log.debug("{} failed with {}: {}", operation, kind, cause.getMessage());
            return ProviderResult.failure(kind, describe(cause));
        }
    }

    private static String describe(Exception e) {
        if (e instanceof ProviderApiException) {
            ProviderApiException apiException = (ProviderApiException) e;
            return "HTTP " + apiException.getStatus()
                    + (apiException.getErrorCode() != null ? " " + apiException.getErrorCode() : "");
        }
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
