package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.exception.ProviderUnavailableException;
import mail.taxonomy.app.model.RoutingTable;
import mail.taxonomy.app.provider.ProviderCredential;
import org.springframework.stereotype.Service;

/**
 * Builds the routing table handed to the workflow engine, from a freshly reconciled record.
 */
@Slf4j
@Service
public class RoutingTableService {
    private final BusinessProfileService businessProfileService;
    private final ProviderCredentialService credentialService;
    private final FolderReconciliationService reconciliationService;
    private final FolderRecordService folderRecordService;
    private final TenantRunLockService runLockService;
    private final RoutingTableBuilder routingTableBuilder;

    public RoutingTableService(BusinessProfileService businessProfileService,
                               ProviderCredentialService credentialService,
                               FolderReconciliationService reconciliationService,
                               FolderRecordService folderRecordService,
                               TenantRunLockService runLockService,
                               RoutingTableBuilder routingTableBuilder) {
        this.businessProfileService = businessProfileService;
        this.credentialService = credentialService;
        this.reconciliationService = reconciliationService;
        this.folderRecordService = folderRecordService;
        this.runLockService = runLockService;
        this.routingTableBuilder = routingTableBuilder;
    }

    /**
     * @throws mail.taxonomy.app.exception.FoldersNotProvisionedException if no folders exist for the tenant
     */
    public RoutingTable buildRoutingTable(String tenantId) {
        BusinessProfile profile = businessProfileService.requireProfile(tenantId);
        return runLockService.runExclusively(tenantId, () -> {
            ProviderCredential credential = credentialService.resolve(tenantId);
            try {
                reconciliationService.reconcile(profile, credential);
            } catch (ProviderUnavailableException e) {
                log.warn("Building routing table for tenant {} from the last reconciled state: {}", tenantId, e.getMessage());
            }
            RoutingTable table = routingTableBuilder.build(tenantId, credential.getProvider(),
                    folderRecordService.activeRecords(profile, credential.getProvider()));
            log.info("Routing table for tenant {} on {} has {} categories",
                    tenantId, table.getProvider(), table.getCategories().size());
            return table;
        });
    }
}
