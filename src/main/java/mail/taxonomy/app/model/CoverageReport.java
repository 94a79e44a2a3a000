package mail.taxonomy.app.model;

import lombok.Value;

import java.util.List;

/**
 * How many of a tenant's folders the classifier can route mail into.
 */
@Value
public class CoverageReport {
    int totalFolders;
    int classifiableFolders;
    List<String> unclassifiableFolders;
    double coveragePercentage;
    boolean healthy;
}
