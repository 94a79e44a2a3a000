package mail.taxonomy.app.exception;

public class TenantBusyException extends RuntimeException {
    public TenantBusyException(String tenantId) {
        super("Another folder run is in progress for tenant: " + tenantId);
    }
}
