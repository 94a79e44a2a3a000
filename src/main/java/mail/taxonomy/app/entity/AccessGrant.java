package mail.taxonomy.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/**
 * Bearer credential written by the OAuth collaborator. Read-only to this engine.
 */
@Embeddable
@Data
public class AccessGrant {
    @ToString.Exclude
    @Column(name = "access_token", length = 4000)
    private String accessToken;

    @Column(name = "access_token_expires_at")
    private Instant expiresAt;

    @Column(name = "granted_scopes", length = 1000)
    private String scopes;
}
