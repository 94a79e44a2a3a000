package mail.taxonomy.app.schema;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered result of schema resolution: top-level categories in provisioning order.
 */
public class FolderTree {
    private final List<String> businessTypes;
    private final List<FolderSpec> categories;

    public FolderTree(List<String> businessTypes, List<FolderSpec> categories) {
        this.businessTypes = List.copyOf(businessTypes);
        this.categories = List.copyOf(categories);
    }

    public List<String> getBusinessTypes() {
        return businessTypes;
    }

    public List<FolderSpec> getCategories() {
        return categories;
    }

    public Optional<FolderSpec> category(String name) {
        return categories.stream().filter(c -> c.getName().equalsIgnoreCase(name)).findFirst();
    }

    public List<FolderSpec> nodes() {
        return categories.stream().flatMap(FolderSpec::flatten).collect(Collectors.toList());
    }

    public Optional<FolderSpec> find(String path) {
        String key = path.toLowerCase(Locale.ROOT);
        return nodes().stream().filter(n -> n.pathKey().equals(key)).findFirst();
    }

    public int size() {
        return nodes().size();
    }

    /**
     * Nodes of this tree whose path does not exist in {@code baseline}, in tree order.
     */
    public List<FolderSpec> nodesMissingFrom(FolderTree baseline) {
        Set<String> known = baseline.nodes().stream().map(FolderSpec::pathKey).collect(Collectors.toSet());
        return Collections.unmodifiableList(nodes().stream().filter(n -> !known.contains(n.pathKey())).collect(Collectors.toList()));
    }
}
