package mail.taxonomy.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A tenant's connected mailbox. Owned by the OAuth collaborator; the engine only
 * reads the grant and flags the account EXPIRED when the provider rejects its token.
 */
@Entity
@Table(name = "mail_accounts", indexes = {
        @Index(name = "idx_mail_accounts_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@ToString(exclude = "grant")
public class MailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MailProvider provider;

    private String emailAddress;

    private boolean active;

    @Embedded
    private AccessGrant grant;

    @Enumerated(EnumType.STRING)
    private SyncStatus syncStatus;

    /**
     * MD5 of the access token the provider rejected when the engine set EXPIRED.
     * Null when the status was written by the OAuth collaborator.
     */
    @Column(name = "rejected_token_fingerprint", length = 32)
    private String rejectedTokenFingerprint;
}
