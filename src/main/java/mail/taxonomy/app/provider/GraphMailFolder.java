package mail.taxonomy.app.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The parts of a Microsoft Graph mailFolder resource the engine uses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphMailFolder {
    private String id;
    private String displayName;
    private String parentFolderId;
    private Integer childFolderCount;
    private Boolean isHidden;

    public boolean hasChildren() {
        return childFolderCount != null && childFolderCount > 0;
    }

    public boolean hidden() {
        return Boolean.TRUE.equals(isHidden);
    }
}
