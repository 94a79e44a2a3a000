package mail.taxonomy.app.exception;

/**
 * The provider could not be reached after the configured retries, for an
 * operation that cannot continue without it (listing during reconciliation).
 */
public class ProviderUnavailableException extends RuntimeException {
    public ProviderUnavailableException(String message) {
        super(message);
    }
}
