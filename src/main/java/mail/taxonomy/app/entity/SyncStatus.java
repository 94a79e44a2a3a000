package mail.taxonomy.app.entity;

public enum SyncStatus {
    ACTIVE,
    EXPIRED,
    ERROR
}
