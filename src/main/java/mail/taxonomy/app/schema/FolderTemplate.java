package mail.taxonomy.app.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One folder as declared in a taxonomy JSON document. Top-level entries are categories
 * and may carry a color; nested entries are subfolders.
 */
@Data
public class FolderTemplate {
    private String name;
    private String description;
    private String intent;
    private LabelColor color;
    private boolean critical;
    private List<FolderTemplate> sub = new ArrayList<>();

    public FolderTemplate copy() {
        FolderTemplate copy = new FolderTemplate();
        copy.setName(name);
        copy.setDescription(description);
        copy.setIntent(intent);
        copy.setColor(color == null ? null : new LabelColor(color.getBackgroundColor(), color.getTextColor()));
        copy.setCritical(critical);
        List<FolderTemplate> children = new ArrayList<>();
        if (sub != null) {
            for (FolderTemplate child : sub) {
                children.add(child.copy());
            }
        }
        copy.setSub(children);
        return copy;
    }

    public List<FolderTemplate> getSub() {
        return sub == null ? List.of() : sub;
    }
}
