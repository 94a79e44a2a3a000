package mail.taxonomy.app.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.exception.SchemaException;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Base taxonomy plus every business-type extension, loaded once from JSON documents.
 * Extensions are looked up by business type or alias, ignoring case.
 */
@Slf4j
public class TaxonomyCatalog {
    private final BaseTaxonomy base;
    private final Map<String, TaxonomyExtension> extensionsByKey = new LinkedHashMap<>();

    public TaxonomyCatalog(BaseTaxonomy base, List<TaxonomyExtension> extensions) {
        validateBase(base);
        this.base = base;
        for (TaxonomyExtension extension : extensions) {
            register(extension);
        }
    }

    /**
     * Loads {@code base.json} and {@code extensions/*.json} below the given location
     * (for example {@code classpath:taxonomy}).
     * @throws SchemaException if a document is missing or malformed
     */
    public static TaxonomyCatalog load(String location) {
        ObjectMapper objectMapper = new ObjectMapper();
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        try {
            Resource baseResource = resolver.getResource(location + "/base.json");
            if (!baseResource.exists()) {
                throw new SchemaException("Base taxonomy not found at " + location + "/base.json");
            }
            BaseTaxonomy base = read(objectMapper, baseResource, BaseTaxonomy.class);

            Resource[] extensionResources = resolver.getResources(location + "/extensions/*.json");
            Arrays.sort(extensionResources, Comparator.comparing(r -> String.valueOf(r.getFilename())));
            List<TaxonomyExtension> extensions = new ArrayList<>();
            for (Resource resource : extensionResources) {
                extensions.add(read(objectMapper, resource, TaxonomyExtension.class));
            }
            TaxonomyCatalog catalog = new TaxonomyCatalog(base, extensions);
            log.info("Loaded taxonomy catalog {} with {} categories and {} business-type extensions",
                    base.getVersion(), base.getCategories().size(), extensions.size());
            return catalog;
        } catch (IOException e) {
            throw new SchemaException("Could not read taxonomy catalog from " + location + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(ObjectMapper objectMapper, Resource resource, Class<T> type) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new SchemaException("Malformed taxonomy document " + resource.getFilename() + ": " + e.getMessage(), e);
        }
    }

    public BaseTaxonomy getBase() {
        return base;
    }

    public Optional<TaxonomyExtension> findExtension(String businessType) {
        if (businessType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensionsByKey.get(key(businessType)));
    }

    public TaxonomyExtension requireExtension(String businessType) {
        return findExtension(businessType)
                .orElseThrow(() -> new SchemaException("No extension found for business type: " + businessType));
    }

    public Set<String> businessTypes() {
        Set<String> types = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        extensionsByKey.values().forEach(e -> types.add(e.getBusinessType()));
        return types;
    }

    private void register(TaxonomyExtension extension) {
        if (extension.getBusinessType() == null || extension.getBusinessType().isBlank()) {
            throw new SchemaException("Taxonomy extension without businessType");
        }
        List<String> keys = new ArrayList<>();
        keys.add(extension.getBusinessType());
        keys.addAll(extension.getAliases());
        for (String name : keys) {
            TaxonomyExtension previous = extensionsByKey.putIfAbsent(key(name), extension);
            if (previous != null && previous != extension) {
                throw new SchemaException("Business type '" + name + "' is declared by both "
                        + previous.getBusinessType() + " and " + extension.getBusinessType());
            }
        }
    }

    private static void validateBase(BaseTaxonomy base) {
        if (base == null || base.getCategories() == null || base.getCategories().isEmpty()) {
            throw new SchemaException("Base taxonomy declares no categories");
        }
        Set<String> names = new HashSet<>();
        for (FolderTemplate category : base.getCategories()) {
            if (category.getName() == null || category.getName().isBlank()) {
                throw new SchemaException("Base taxonomy contains a category without a name");
            }
            if (!names.add(SchemaResolver.categoryKey(category.getName()))) {
                throw new SchemaException("Base taxonomy declares category twice: " + category.getName());
            }
        }
        for (String ordered : base.getProvisioningOrder()) {
            if (!names.contains(SchemaResolver.categoryKey(ordered))) {
                throw new SchemaException("Base provisioning order names unknown category: " + ordered);
            }
        }
    }

    private static String key(String businessType) {
        return businessType.trim().toLowerCase(Locale.ROOT);
    }
}
