package mail.taxonomy.app.service;

import mail.taxonomy.app.config.TaxonomyProperties;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import mail.taxonomy.app.model.CoverageReport;
import mail.taxonomy.app.schema.ExpectedCategorySet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Advisory check of which recorded folders the classifier can route mail into.
 * Reads only; never changes records.
 */
@Component
public class FolderCoverageValidator {
    private final TaxonomyProperties properties;

    public FolderCoverageValidator(TaxonomyProperties properties) {
        this.properties = properties;
    }

    /**
     * @param records non-deleted folder records of one tenant
     * @param expected names the classifier may emit
     */
    public CoverageReport validate(Collection<ProviderFolderRecord> records, ExpectedCategorySet expected) {
        int total = 0;
        int classifiable = 0;
        List<String> unclassifiable = new ArrayList<>();
        for (ProviderFolderRecord record : records) {
            if (record.isDeleted()) {
                continue;
            }
            total++;
            if (expected.contains(record.leafName())) {
                classifiable++;
            } else {
                unclassifiable.add(record.effectivePath());
            }
        }
        unclassifiable.sort(String.CASE_INSENSITIVE_ORDER);

        double percentage = total == 0 ? 0.0 : round(classifiable * 100.0 / total);
        boolean healthy = total > 0 && percentage >= properties.getCoverage().getHealthyThreshold();
        return new CoverageReport(total, classifiable, List.copyOf(unclassifiable), percentage, healthy);
    }

    static double round(double percentage) {
        return Math.round(percentage * 10.0) / 10.0;
    }
}
