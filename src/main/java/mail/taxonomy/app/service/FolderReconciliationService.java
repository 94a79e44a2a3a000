package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.config.TaxonomyProperties;
import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.entity.MailAccount;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.exception.AuthException;
import mail.taxonomy.app.exception.ProviderUnavailableException;
import mail.taxonomy.app.model.ReconciliationResult;
import mail.taxonomy.app.provider.*;
import mail.taxonomy.app.repository.MailAccountRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Brings the local folder record in line with what the provider actually has:
 * listed folders are upserted, records missing from the listing are soft-deleted.
 */
@Slf4j
@Service
public class FolderReconciliationService {
    private final BusinessProfileService businessProfileService;
    private final ProviderCredentialService credentialService;
    private final FolderProviderRegistry providerRegistry;
    private final FolderRecordService folderRecordService;
    private final TenantRunLockService runLockService;
    private final MailAccountRepository mailAccountRepository;
    private final TaxonomyProperties properties;
    private final Executor reconciliationExecutor;

    public FolderReconciliationService(
            BusinessProfileService businessProfileService,
            ProviderCredentialService credentialService,
            FolderProviderRegistry providerRegistry,
            FolderRecordService folderRecordService,
            TenantRunLockService runLockService,
            MailAccountRepository mailAccountRepository,
            TaxonomyProperties properties,
            @Qualifier("reconciliationExecutor") Executor reconciliationExecutor) {
        this.businessProfileService = businessProfileService;
        this.credentialService = credentialService;
        this.providerRegistry = providerRegistry;
        this.folderRecordService = folderRecordService;
        this.runLockService = runLockService;
        this.mailAccountRepository = mailAccountRepository;
        this.properties = properties;
        this.reconciliationExecutor = reconciliationExecutor;
    }

    /**
     * On-demand reconciliation for one tenant.
     * @throws mail.taxonomy.app.exception.TenantBusyException if a run for the tenant is in progress
     * @throws AuthException if the credential is unusable
     * @throws ProviderUnavailableException if the provider cannot be listed
     */
    public ReconciliationResult reconcile(String tenantId) {
        BusinessProfile profile = businessProfileService.requireProfile(tenantId);
        return runLockService.runExclusively(tenantId, () ->
                reconcile(profile, credentialService.resolve(tenantId)));
    }

    /**
     * Reconciles with the given credential. The caller holds the tenant's run lock.
     */
    public ReconciliationResult reconcile(BusinessProfile profile, ProviderCredential credential) {
        MailProvider provider = credential.getProvider();
        FolderProviderAdapter adapter = providerRegistry.adapterFor(provider);

        Instant listedAt = Instant.now();
        ProviderResult<List<RemoteFolder>> listing = adapter.list(credential, properties.getProvider().getCallTimeout());
        if (!listing.isOk()) {
            if (listing.getErrorKind() == ProviderErrorKind.AUTH) {
                credentialService.markRejected(credential);
                throw new AuthException("Mail provider rejected the credential for tenant: " + credential.getTenantId());
            }
            throw new ProviderUnavailableException("Could not list folders on " + provider
                    + " for tenant " + credential.getTenantId() + ": " + listing.getMessage());
        }

        int discovered = 0;
        int updated = 0;
        int restored = 0;
        Set<String> observedIds = new HashSet<>();
        for (RemoteFolder folder : listing.getValue()) {
            observedIds.add(folder.getId());
            switch (folderRecordService.upsert(profile, provider, folder, listedAt)) {
                case CREATED:
                    discovered++;
                    log.debug("Discovered folder '{}' ({}) for tenant {}", folder.getPath(), folder.getId(), credential.getTenantId());
                    break;
                case RESTORED:
                    restored++;
                    break;
                case UPDATED:
                    updated++;
                    break;
                default:
                    break;
            }
        }
        int markedDeleted = folderRecordService.markDeletedExcept(profile, provider, observedIds, listedAt);

        log.info("Reconciled {} folders on {} for tenant {}: {} discovered, {} updated, {} restored, {} marked deleted",
                observedIds.size(), provider, credential.getTenantId(), discovered, updated, restored, markedDeleted);
        return ReconciliationResult.builder()
                .tenantId(credential.getTenantId())
                .provider(provider)
                .observed(observedIds.size())
                .discovered(discovered)
                .updated(updated)
                .restored(restored)
                .markedDeleted(markedDeleted)
                .reconciledAt(listedAt)
                .build();
    }

    /**
     * Periodic pass over every tenant with a connected mailbox. Busy tenants are skipped
     * and one tenant's failure never stops the others.
     */
    @Scheduled(fixedDelayString = "${taxonomy.reconciliation.interval:PT15M}",
            initialDelayString = "${taxonomy.reconciliation.initial-delay:PT1M}")
    public void reconcileAllTenants() {
        if (!properties.getReconciliation().isEnabled()) {
            return;
        }
        List<String> tenantIds = mailAccountRepository.findByActiveTrue().stream()
                .map(MailAccount::getTenantId)
                .distinct()
                .collect(Collectors.toList());
        if (tenantIds.isEmpty()) {
            return;
        }
        log.info("Starting scheduled folder reconciliation for {} tenants", tenantIds.size());

        List<CompletableFuture<Void>> futures = tenantIds.stream()
                .map(tenantId -> CompletableFuture.runAsync(() -> reconcileQuietly(tenantId), reconciliationExecutor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        log.info("Scheduled folder reconciliation finished");
    }

    private void reconcileQuietly(String tenantId) {
        try {
            BusinessProfile profile = businessProfileService.requireProfile(tenantId);
            Optional<ReconciliationResult> result = runLockService.runIfFree(tenantId,
                    () -> reconcile(profile, credentialService.resolve(tenantId)));
            if (result.isEmpty()) {
                log.debug("Skipping reconciliation for tenant {}: another run is in progress", tenantId);
            }
        } catch (AuthException e) {
            log.warn("Skipping reconciliation for tenant {}: {}", tenantId, e.getMessage());
        } catch (ProviderUnavailableException e) {
            log.warn("Reconciliation for tenant {} deferred: {}", tenantId, e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed for tenant {}: {}", tenantId, e.getMessage(), e);
        }
    }
}
