package mail.taxonomy.app.service;

import mail.taxonomy.app.config.TaxonomyProperties;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import mail.taxonomy.app.exception.FoldersNotProvisionedException;
import mail.taxonomy.app.model.RoutingTable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Projects non-deleted folder records into category key to folder ids. Keys depend only
 * on folder names, so the table is stable while the names are.
 */
@Component
public class RoutingTableBuilder {
    private final TaxonomyProperties properties;

    public RoutingTableBuilder(TaxonomyProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws FoldersNotProvisionedException if the tenant has no live folder records
     */
    public RoutingTable build(String tenantId, MailProvider provider, Collection<ProviderFolderRecord> records) {
        List<ProviderFolderRecord> live = records.stream()
                .filter(record -> !record.isDeleted())
                .sorted(Comparator.comparing(ProviderFolderRecord::effectivePath, String.CASE_INSENSITIVE_ORDER))
                .collect(Collectors.toList());
        if (live.isEmpty()) {
            throw new FoldersNotProvisionedException(tenantId);
        }

        Map<String, List<String>> below = new LinkedHashMap<>();
        Map<String, String> topLevelIds = new LinkedHashMap<>();
        for (ProviderFolderRecord record : live) {
            String key = normalize(record.topLevelName());
            if (record.isTopLevel()) {
                topLevelIds.putIfAbsent(key, record.getLabelId());
            } else {
                below.computeIfAbsent(key, k -> new ArrayList<>()).add(record.getLabelId());
            }
        }

        Map<String, List<String>> categories = new TreeMap<>();
        below.forEach((key, ids) -> categories.put(key, List.copyOf(ids)));
        topLevelIds.forEach((key, id) -> categories.putIfAbsent(key, List.of(id)));
        return new RoutingTable(tenantId, provider, Collections.unmodifiableMap(categories), Instant.now());
    }

    /**
     * "GOOGLE REVIEW" becomes {@code google_review}; "FORMSUB" folds to {@code forms} through the alias map.
     */
    public String normalize(String categoryName) {
        String key = categoryName.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return properties.getRouting().getAliases().getOrDefault(key, key);
    }
}
