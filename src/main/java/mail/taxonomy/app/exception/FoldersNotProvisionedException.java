package mail.taxonomy.app.exception;

public class FoldersNotProvisionedException extends RuntimeException {
    public FoldersNotProvisionedException(String tenantId) {
        super("Folders have not been provisioned for tenant: " + tenantId);
    }
}
