package mail.taxonomy.app.schema;

import lombok.Getter;
import mail.taxonomy.app.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A node of the resolved folder tree. The parent owns its children; {@link #getParent()}
 * is a back-reference only. Sibling names are unique ignoring case.
 */
@Getter
public class FolderSpec {
    public static final String PATH_SEPARATOR = "/";

    private final String name;
    private final FolderSpec parent;
    private final FolderKind kind;
    private final int depth;
    private final LabelColor color;
    private final List<FolderSpec> children = new ArrayList<>();

    private FolderSpec(String name, FolderSpec parent, FolderKind kind, LabelColor color) {
        this.name = name;
        this.parent = parent;
        this.kind = kind;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.color = color;
    }

    public static FolderSpec category(String name, LabelColor color) {
        requireUsableName(name, null);
        return new FolderSpec(name.trim(), null, FolderKind.CORE, color);
    }

    /**
     * Appends a child node.
     * @throws SchemaException if the name is blank, contains the path separator, or a sibling already uses it
     */
    public FolderSpec addChild(String childName, FolderKind childKind, LabelColor childColor) {
        requireUsableName(childName, this);
        String trimmed = childName.trim();
        if (findChild(trimmed).isPresent()) {
            throw new SchemaException("Duplicate folder name '" + trimmed + "' under " + path());
        }
        FolderSpec child = new FolderSpec(trimmed, this, childKind, childColor != null ? childColor : color);
        children.add(child);
        return child;
    }

    public Optional<FolderSpec> findChild(String childName) {
        if (childName == null) {
            return Optional.empty();
        }
        String wanted = childName.trim();
        return children.stream().filter(c -> c.name.equalsIgnoreCase(wanted)).findFirst();
    }

    public List<FolderSpec> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public String path() {
        return parent == null ? name : parent.path() + PATH_SEPARATOR + name;
    }

    public String pathKey() {
        return path().toLowerCase(Locale.ROOT);
    }

    public boolean isTopLevel() {
        return parent == null;
    }

    public boolean isDynamic() {
        return kind != FolderKind.CORE;
    }

    /**
     * This node followed by all descendants, parents always before children.
     */
    public Stream<FolderSpec> flatten() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(FolderSpec::flatten));
    }

    private static void requireUsableName(String candidate, FolderSpec parent) {
        String where = parent == null ? "top level" : parent.path();
        if (candidate == null || candidate.isBlank()) {
            throw new SchemaException("Blank folder name at " + where);
        }
        if (candidate.contains(PATH_SEPARATOR)) {
            throw new SchemaException("Folder name '" + candidate + "' at " + where + " must not contain '" + PATH_SEPARATOR + "'");
        }
    }

    @Override
    public String toString() {
        return "FolderSpec{" + path() + ", " + kind + "}";
    }
}
