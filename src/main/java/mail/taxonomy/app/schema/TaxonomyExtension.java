package mail.taxonomy.app.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Business-type specific changes applied on top of the base taxonomy.
 * Overrides replace the subfolders of an existing category, additions introduce new categories.
 */
@Data
public class TaxonomyExtension {
    private String businessType;
    private String version;
    private List<String> aliases = new ArrayList<>();
    private Map<String, FolderTemplate> overrides = new LinkedHashMap<>();
    private List<FolderTemplate> additions = new ArrayList<>();
    private List<String> provisioningOrder = new ArrayList<>();

    public List<String> getAliases() {
        return aliases == null ? List.of() : aliases;
    }

    public Map<String, FolderTemplate> getOverrides() {
        return overrides == null ? Map.of() : overrides;
    }

    public List<FolderTemplate> getAdditions() {
        return additions == null ? List.of() : additions;
    }

    public List<String> getProvisioningOrder() {
        return provisioningOrder == null ? List.of() : provisioningOrder;
    }
}
