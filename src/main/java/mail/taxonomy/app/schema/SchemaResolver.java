package mail.taxonomy.app.schema;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.exception.SchemaException;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Merges the base taxonomy, the tenant's business-type extensions and the current
 * team member and supplier names into one ordered {@link FolderTree}.
 * Deterministic and free of I/O.
 */
@Slf4j
@Component
public class SchemaResolver {
    public static final String MANAGER = "MANAGER";
    public static final String SUPPLIERS = "SUPPLIERS";
    public static final String UNASSIGNED = "Unassigned";
    private static final String MISC = "MISC";
    private static final Pattern PLACEHOLDER = Pattern.compile("^\\{\\{.*}}$");

    private final TaxonomyCatalog catalog;

    public SchemaResolver(TaxonomyCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Core tree for the given business types, without team or supplier folders.
     */
    public FolderTree resolveSkeleton(List<String> businessTypes) {
        return resolve(businessTypes, List.of(), List.of());
    }

    /**
     * @param businessTypes business types or aliases, first one wins ordering decisions
     * @param teamNames names attached under MANAGER, may be empty
     * @param supplierNames names attached under SUPPLIERS, may be empty
     * @throws SchemaException for unknown business types, malformed extensions or duplicate siblings
     */
    public FolderTree resolve(List<String> businessTypes, List<String> teamNames, List<String> supplierNames) {
        if (businessTypes == null || businessTypes.isEmpty()) {
            throw new SchemaException("At least one business type is required");
        }
        List<TaxonomyExtension> extensions = new ArrayList<>();
        for (String businessType : businessTypes) {
            TaxonomyExtension extension = catalog.requireExtension(businessType);
            if (!extensions.contains(extension)) {
                extensions.add(extension);
            }
        }

        Map<String, FolderTemplate> categories = new LinkedHashMap<>();
        for (FolderTemplate category : catalog.getBase().getCategories()) {
            categories.put(categoryKey(category.getName()), category.copy());
        }

        Set<String> overridden = new HashSet<>();
        List<String> additions = new ArrayList<>();
        for (TaxonomyExtension extension : extensions) {
            for (FolderTemplate addition : extension.getAdditions()) {
                String key = categoryKey(addition.getName());
                FolderTemplate existing = categories.get(key);
                if (existing == null) {
                    categories.put(key, addition.copy());
                    additions.add(key);
                } else {
                    existing.setSub(union(existing.getSub(), addition.getSub()));
                }
            }
            for (Map.Entry<String, FolderTemplate> override : extension.getOverrides().entrySet()) {
                String key = categoryKey(override.getKey());
                FolderTemplate target = categories.get(key);
                if (target == null) {
                    throw new SchemaException("Extension '" + extension.getBusinessType()
                            + "' overrides unknown category: " + override.getKey());
                }
                List<FolderTemplate> replacement = copyAll(override.getValue().getSub());
                if (overridden.add(key)) {
                    target.setSub(replacement);
                } else {
                    target.setSub(union(target.getSub(), replacement));
                }
                if (override.getValue().getDescription() != null) {
                    target.setDescription(override.getValue().getDescription());
                }
            }
        }

        List<FolderSpec> roots = new ArrayList<>();
        for (String key : provisioningOrder(extensions, additions, categories)) {
            FolderTemplate template = categories.get(key);
            FolderSpec root = FolderSpec.category(template.getName(), template.getColor());
            addTemplateChildren(root, template.getSub());
            roots.add(root);
        }
        FolderTree tree = new FolderTree(businessTypes, roots);

        FolderSpec manager = tree.category(MANAGER)
                .orElseThrow(() -> new SchemaException("Taxonomy has no " + MANAGER + " category"));
        if (manager.findChild(UNASSIGNED).isEmpty()) {
            manager.addChild(UNASSIGNED, FolderKind.CORE, null);
        }
        attachDynamic(manager, teamNames, FolderKind.DYNAMIC_TEAM);

        List<String> suppliers = supplierNames == null ? List.of() : supplierNames;
        Optional<FolderSpec> supplierRoot = tree.category(SUPPLIERS);
        if (supplierRoot.isPresent()) {
            attachDynamic(supplierRoot.get(), suppliers, FolderKind.DYNAMIC_SUPPLIER);
        } else if (suppliers.stream().anyMatch(s -> s != null && !s.isBlank())) {
            throw new SchemaException("Suppliers supplied but taxonomy has no " + SUPPLIERS + " category");
        }
        return tree;
    }

    public ExpectedCategorySet expectedCategories(List<String> businessTypes, List<String> teamNames, List<String> supplierNames) {
        return ExpectedCategorySet.from(resolve(businessTypes, teamNames, supplierNames));
    }

    /**
     * Category names compare ignoring case, with '_' equivalent to a space ("GOOGLE_REVIEW" is "GOOGLE REVIEW").
     */
    static String categoryKey(String name) {
        return name.trim().replace('_', ' ').replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    private List<String> provisioningOrder(List<TaxonomyExtension> extensions, List<String> additions,
                                           Map<String, FolderTemplate> categories) {
        List<String> declared = extensions.stream()
                .map(TaxonomyExtension::getProvisioningOrder)
                .filter(order -> !order.isEmpty())
                .findFirst()
                .orElse(null);

        List<String> order = new ArrayList<>();
        if (declared != null) {
            declared.forEach(name -> order.add(categoryKey(name)));
        } else {
            catalog.getBase().getProvisioningOrder().forEach(name -> order.add(categoryKey(name)));
            int miscIndex = order.indexOf(MISC);
            order.addAll(miscIndex < 0 ? order.size() : miscIndex, additions);
        }

        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (String key : order) {
            if (!categories.containsKey(key)) {
                throw new SchemaException("Provisioning order names unknown category: " + key);
            }
            result.add(key);
        }
        result.addAll(categories.keySet());
        return new ArrayList<>(result);
    }

    private void addTemplateChildren(FolderSpec parent, List<FolderTemplate> templates) {
        for (FolderTemplate template : templates) {
            if (isPlaceholder(template.getName())) {
                continue;
            }
            FolderSpec child = parent.addChild(template.getName(), FolderKind.CORE, template.getColor());
            addTemplateChildren(child, template.getSub());
        }
    }

    private void attachDynamic(FolderSpec parent, List<String> names, FolderKind kind) {
        if (names == null) {
            return;
        }
        for (String raw : names) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String name = raw.trim();
            if (name.contains(FolderSpec.PATH_SEPARATOR)) {
                log.warn("Skipping {} folder '{}': names must not contain '{}'", kind, name, FolderSpec.PATH_SEPARATOR);
                continue;
            }
            if (parent.findChild(name).isPresent()) {
                log.debug("Skipping {} folder '{}': already present under {}", kind, name, parent.getName());
                continue;
            }
            parent.addChild(name, kind, null);
        }
    }

    private static List<FolderTemplate> union(List<FolderTemplate> existing, List<FolderTemplate> extra) {
        List<FolderTemplate> merged = copyAll(existing);
        for (FolderTemplate candidate : extra) {
            Optional<FolderTemplate> match = merged.stream()
                    .filter(t -> t.getName().equalsIgnoreCase(candidate.getName()))
                    .findFirst();
            if (match.isPresent()) {
                match.get().setSub(union(match.get().getSub(), candidate.getSub()));
            } else {
                merged.add(candidate.copy());
            }
        }
        return merged;
    }

    private static List<FolderTemplate> copyAll(List<FolderTemplate> templates) {
        List<FolderTemplate> copies = new ArrayList<>();
        for (FolderTemplate template : templates) {
            if (!isPlaceholder(template.getName())) {
                copies.add(template.copy());
            }
        }
        return copies;
    }

    private static boolean isPlaceholder(String name) {
        return name != null && PLACEHOLDER.matcher(name.trim()).matches();
    }
}
