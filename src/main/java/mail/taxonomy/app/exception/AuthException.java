package mail.taxonomy.app.exception;

/**
 * The tenant's mail credential is missing, expired or rejected by the provider.
 * Fatal for the whole run; the caller has to reconnect the account and re-invoke.
 */
public class AuthException extends RuntimeException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
