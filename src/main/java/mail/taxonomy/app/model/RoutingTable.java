package mail.taxonomy.app.model;

import lombok.Value;
import mail.taxonomy.app.entity.MailProvider;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Category key to provider folder ids, consumed by the workflow engine. Keys are sorted
 * and derived from folder names only, so they stay stable across reconciliation runs.
 */
@Value
public class RoutingTable {
    String tenantId;
    MailProvider provider;
    Map<String, List<String>> categories;
    Instant generatedAt;

    public List<String> idsFor(String categoryKey) {
        return categories.getOrDefault(categoryKey, List.of());
    }
}
