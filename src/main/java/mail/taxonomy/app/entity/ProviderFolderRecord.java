package mail.taxonomy.app.entity;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Local record of one remote folder or label, as last observed on the provider.
 * Records are soft-deleted only, so past routing decisions stay auditable.
 */
@Entity
@Table(name = "provider_folder_records",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_folder_record_profile_provider_label",
                columnNames = {"business_profile_id", "provider", "label_id"}),
        indexes = {
                @Index(name = "idx_folder_record_profile", columnList = "business_profile_id"),
                @Index(name = "idx_folder_record_provider_label", columnList = "provider, label_id")
        })
@Getter
@Setter
@ToString(exclude = "businessProfile")
@EqualsAndHashCode(exclude = "businessProfile")
public class ProviderFolderRecord {
    public static final String PATH_SEPARATOR = "/";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "business_profile_id", nullable = false)
    private BusinessProfile businessProfile;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MailProvider provider;

    @Column(name = "label_id", nullable = false, length = 512)
    private String labelId;

    @Column(name = "label_name", nullable = false, length = 1024)
    private String labelName;

    // Logical path ("BANKING/Invoice") regardless of how the provider models hierarchy
    @Column(name = "label_path", length = 2048)
    private String labelPath;

    @Column(name = "parent_label_id", length = 512)
    private String parentLabelId;

    private String color;

    @Column(name = "synced_at", nullable = false)
    private Instant syncedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public String effectivePath() {
        return labelPath != null && !labelPath.isBlank() ? labelPath : labelName;
    }

    public String topLevelName() {
        String path = effectivePath();
        int idx = path.indexOf(PATH_SEPARATOR);
        return idx < 0 ? path : path.substring(0, idx);
    }

    public String leafName() {
        String path = effectivePath();
        int idx = path.lastIndexOf(PATH_SEPARATOR);
        return idx < 0 ? path : path.substring(idx + 1);
    }

    public boolean isTopLevel() {
        return !effectivePath().contains(PATH_SEPARATOR);
    }
}
