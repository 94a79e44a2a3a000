package mail.taxonomy.app.provider;

public enum ProviderErrorKind {
    /** Network failure, timeout, throttling or 5xx. Retried per provider policy. */
    TRANSIENT,
    /** Credential expired, revoked or missing consent. Never retried. */
    AUTH,
    /** Request refused for good (bad name, not found, quota exhausted). Never retried. */
    REJECTED
}
