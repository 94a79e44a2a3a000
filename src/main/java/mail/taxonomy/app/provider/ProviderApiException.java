package mail.taxonomy.app.provider;

import lombok.Getter;

/**
 * HTTP level failure reported by a provider API, carrying the status and
 * the provider's own error code or reason (e.g. "ErrorFolderExists", "rateLimitExceeded").
 */
@Getter
public class ProviderApiException extends RuntimeException {
    private final int status;
    private final String errorCode;

    public ProviderApiException(int status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public ProviderApiException(int status, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
