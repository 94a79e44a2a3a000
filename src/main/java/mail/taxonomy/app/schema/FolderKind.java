package mail.taxonomy.app.schema;

public enum FolderKind {
    CORE,
    DYNAMIC_TEAM,
    DYNAMIC_SUPPLIER
}
