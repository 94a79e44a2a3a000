package mail.taxonomy.app.exception;

/**
 * Malformed taxonomy catalog, unknown business type or duplicate sibling folder names.
 * Raised before any provider call is made.
 */
public class SchemaException extends RuntimeException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
