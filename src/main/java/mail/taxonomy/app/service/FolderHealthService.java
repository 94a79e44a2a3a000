package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import mail.taxonomy.app.model.CoverageReport;
import mail.taxonomy.app.model.HealthReport;
import mail.taxonomy.app.schema.ExpectedCategorySet;
import mail.taxonomy.app.schema.FolderSpec;
import mail.taxonomy.app.schema.FolderTree;
import mail.taxonomy.app.schema.SchemaResolver;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares the local folder record with the tenant's resolved tree. Works from the
 * last reconciliation only; no provider call is made and nothing is written.
 */
@Slf4j
@Service
public class FolderHealthService {
    private final BusinessProfileService businessProfileService;
    private final ProviderCredentialService credentialService;
    private final SchemaResolver schemaResolver;
    private final FolderRecordService folderRecordService;
    private final FolderCoverageValidator coverageValidator;

    public FolderHealthService(BusinessProfileService businessProfileService,
                               ProviderCredentialService credentialService,
                               SchemaResolver schemaResolver,
                               FolderRecordService folderRecordService,
                               FolderCoverageValidator coverageValidator) {
        this.businessProfileService = businessProfileService;
        this.credentialService = credentialService;
        this.schemaResolver = schemaResolver;
        this.folderRecordService = folderRecordService;
        this.coverageValidator = coverageValidator;
    }

    public HealthReport checkHealth(String tenantId) {
        BusinessProfile profile = businessProfileService.requireProfile(tenantId);
        List<String> businessTypes = businessProfileService.requireBusinessTypes(profile);
        MailProvider provider = credentialService.activeProvider(tenantId);

        FolderTree expectedTree = schemaResolver.resolve(businessTypes, profile.teamMemberNames(), profile.supplierNames());
        List<ProviderFolderRecord> records = folderRecordService.activeRecords(profile, provider);

        Set<String> recordedPaths = records.stream()
                .map(record -> record.effectivePath().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<FolderSpec> expectedNodes = expectedTree.nodes();
        List<String> missing = expectedNodes.stream()
                .filter(node -> !recordedPaths.contains(node.pathKey()))
                .map(FolderSpec::path)
                .collect(Collectors.toList());

        int present = expectedNodes.size() - missing.size();
        double folderHealth = expectedNodes.isEmpty() ? 0.0
                : FolderCoverageValidator.round(present * 100.0 / expectedNodes.size());

        CoverageReport coverage = coverageValidator.validate(records, ExpectedCategorySet.from(expectedTree));
        log.info("Folder health for tenant {} on {}: {}% present, {}% classifiable",
                tenantId, provider, folderHealth, coverage.getCoveragePercentage());
        if (!coverage.isHealthy() && !coverage.getUnclassifiableFolders().isEmpty()) {
            log.warn("Tenant {} has folders the classifier cannot route to: {}", tenantId, coverage.getUnclassifiableFolders());
        }
        return new HealthReport(tenantId, provider, folderHealth, expectedNodes.size(), List.copyOf(missing), coverage);
    }
}
