package mail.taxonomy.app.schema;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Folder names the downstream classifier may emit for a tenant: every category,
 * every declared subfolder and every current team member and supplier name.
 */
public final class ExpectedCategorySet {
    private final Set<String> names;

    private ExpectedCategorySet(Set<String> names) {
        this.names = Collections.unmodifiableSet(names);
    }

    public static ExpectedCategorySet from(FolderTree tree) {
        Set<String> names = new HashSet<>();
        tree.nodes().forEach(node -> names.add(normalize(node.getName())));
        return new ExpectedCategorySet(names);
    }

    public ExpectedCategorySet plus(String name) {
        Set<String> extended = new HashSet<>(names);
        extended.add(normalize(name));
        return new ExpectedCategorySet(extended);
    }

    public boolean contains(String name) {
        return name != null && names.contains(normalize(name));
    }

    public Set<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
