package mail.taxonomy.app.entity;

/**
 * Mail providers the engine can provision folders on.
 * GMAIL exposes a flat label namespace, OUTLOOK exposes nested folders.
 */
public enum MailProvider {
    GMAIL,
    OUTLOOK
}
