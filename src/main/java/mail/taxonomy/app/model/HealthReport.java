package mail.taxonomy.app.model;

import lombok.Value;
import mail.taxonomy.app.entity.MailProvider;

import java.util.List;

@Value
public class HealthReport {
    String tenantId;
    MailProvider provider;
    /** Share of expected folders present remotely, per the last reconciliation. */
    double folderHealthPercentage;
    int expectedFolders;
    List<String> missingFolders;
    CoverageReport classifierCoverage;
}
