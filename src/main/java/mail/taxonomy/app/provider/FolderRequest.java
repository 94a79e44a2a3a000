package mail.taxonomy.app.provider;

import lombok.Value;
import mail.taxonomy.app.schema.FolderSpec;
import mail.taxonomy.app.schema.LabelColor;

/**
 * A folder to create or look up. {@code name} is the leaf name, {@code path} the full logical
 * path ("BANKING/Invoice") and {@code parentRef} the provider id of the parent, null at top level.
 * Each adapter uses whichever of these its hierarchy model needs.
 */
@Value
public class FolderRequest {
    String name;
    String path;
    String parentRef;
    LabelColor color;

    public static FolderRequest of(FolderSpec spec, String parentRef) {
        return new FolderRequest(spec.getName(), spec.path(), parentRef, spec.getColor());
    }

    public FolderRequest withoutColor() {
        return new FolderRequest(name, path, parentRef, null);
    }
}
