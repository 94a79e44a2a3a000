package mail.taxonomy.app.model;

import lombok.Builder;
import lombok.Value;
import mail.taxonomy.app.entity.MailProvider;

import java.time.Instant;

@Value
@Builder
public class ReconciliationResult {
    String tenantId;
    MailProvider provider;
    /** Folders listed by the provider. */
    int observed;
    /** Remote folders seen for the first time. */
    int discovered;
    int updated;
    /** Soft-deleted records that showed up remotely again. */
    int restored;
    int markedDeleted;
    Instant reconciledAt;
}
