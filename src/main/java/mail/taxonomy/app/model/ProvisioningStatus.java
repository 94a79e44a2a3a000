package mail.taxonomy.app.model;

public enum ProvisioningStatus {
    COMPLETE,
    PARTIAL
}
