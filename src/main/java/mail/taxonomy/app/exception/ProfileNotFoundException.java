package mail.taxonomy.app.exception;

public class ProfileNotFoundException extends RuntimeException {
    public ProfileNotFoundException(String tenantId) {
        super("Business profile not found for tenant: " + tenantId);
    }
}
