package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.config.TaxonomyProperties;
import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.exception.AuthException;
import mail.taxonomy.app.exception.ProviderUnavailableException;
import mail.taxonomy.app.exception.SchemaException;
import mail.taxonomy.app.model.FailedFolder;
import mail.taxonomy.app.model.PartialSuccessReport;
import mail.taxonomy.app.model.ProvisioningPhase;
import mail.taxonomy.app.provider.*;
import mail.taxonomy.app.schema.FolderSpec;
import mail.taxonomy.app.schema.FolderTree;
import mail.taxonomy.app.schema.SchemaResolver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Makes the tenant's mailbox match the resolved folder tree, in two phases:
 * the core skeleton when a business type is chosen, then team member and supplier
 * folders once that data is saved. Every node is create-or-resolve, so any run can be repeated.
 * Top-level branches run in parallel on the provisioning pool; nodes inside a branch are
 * processed parents first.
 */
@Slf4j
@Service
public class FolderProvisioningService {
    private final SchemaResolver schemaResolver;
    private final BusinessProfileService businessProfileService;
    private final ProviderCredentialService credentialService;
    private final FolderProviderRegistry providerRegistry;
    private final FolderRecordService folderRecordService;
    private final FolderReconciliationService reconciliationService;
    private final TenantRunLockService runLockService;
    private final TaxonomyProperties properties;
    private final Executor provisioningExecutor;

    public FolderProvisioningService(
            SchemaResolver schemaResolver,
            BusinessProfileService businessProfileService,
            ProviderCredentialService credentialService,
            FolderProviderRegistry providerRegistry,
            FolderRecordService folderRecordService,
            FolderReconciliationService reconciliationService,
            TenantRunLockService runLockService,
            TaxonomyProperties properties,
            @Qualifier("folderProvisioningExecutor") Executor provisioningExecutor) {
        this.schemaResolver = schemaResolver;
        this.businessProfileService = businessProfileService;
        this.credentialService = credentialService;
        this.providerRegistry = providerRegistry;
        this.folderRecordService = folderRecordService;
        this.reconciliationService = reconciliationService;
        this.runLockService = runLockService;
        this.properties = properties;
        this.provisioningExecutor = provisioningExecutor;
    }

    /**
     * Creates the core folder tree of {@code businessType}, without team or supplier folders.
     * @throws SchemaException before any provider call if the business type cannot be resolved
     * @throws AuthException if the credential is unusable or rejected mid-run
     */
    public PartialSuccessReport provisionSkeleton(String tenantId, String businessType) {
        if (businessType == null || businessType.isBlank()) {
            throw new SchemaException("A business type is required");
        }
        BusinessProfile profile = businessProfileService.requireProfile(tenantId);
        FolderTree skeleton = schemaResolver.resolveSkeleton(List.of(businessType.trim()));
        log.info("Provisioning {} skeleton folders for tenant {} ({})", skeleton.size(), tenantId, businessType);

        return runLockService.runExclusively(tenantId, () -> {
            ProviderCredential credential = credentialService.resolve(tenantId);
            reconcileBeforeRun(profile, credential);
            List<Branch> branches = skeleton.getCategories().stream()
                    .map(category -> new Branch(category, null))
                    .collect(Collectors.toList());
            return run(ProvisioningPhase.SKELETON, profile, credential, branches);
        });
    }

    /**
     * Creates the folders introduced by the profile's current team members and suppliers.
     * Folders already in the skeleton are not touched.
     */
    public PartialSuccessReport injectTeamFolders(String tenantId) {
        BusinessProfile profile = businessProfileService.requireProfile(tenantId);
        List<String> businessTypes = businessProfileService.requireBusinessTypes(profile);
        FolderTree skeleton = schemaResolver.resolveSkeleton(businessTypes);
        FolderTree full = schemaResolver.resolve(businessTypes, profile.teamMemberNames(), profile.supplierNames());
        List<FolderSpec> introduced = full.nodesMissingFrom(skeleton);

        if (introduced.isEmpty()) {
            log.info("No team or supplier folders to add for tenant {}", tenantId);
            Instant now = Instant.now();
            return PartialSuccessReport.builder()
                    .tenantId(tenantId)
                    .phase(ProvisioningPhase.TEAM_INJECTION)
                    .created(List.of())
                    .alreadyExisted(List.of())
                    .failed(List.of())
                    .startedAt(now)
                    .finishedAt(now)
                    .build();
        }
        log.info("Injecting {} team and supplier folders for tenant {}", introduced.size(), tenantId);

        return runLockService.runExclusively(tenantId, () -> {
            ProviderCredential credential = credentialService.resolve(tenantId);
            reconcileBeforeRun(profile, credential);

            Map<FolderSpec, Set<String>> targetsByCategory = new LinkedHashMap<>();
            for (FolderSpec node : introduced) {
                targetsByCategory.computeIfAbsent(rootOf(node), root -> new HashSet<>()).add(node.pathKey());
            }
            List<Branch> branches = targetsByCategory.entrySet().stream()
                    .map(entry -> new Branch(entry.getKey(), entry.getValue()))
                    .collect(Collectors.toList());
            return run(ProvisioningPhase.TEAM_INJECTION, profile, credential, branches);
        });
    }

    private void reconcileBeforeRun(BusinessProfile profile, ProviderCredential credential) {
        try {
            reconciliationService.reconcile(profile, credential);
        } catch (ProviderUnavailableException e) {
            // Provisioning is create-or-resolve, so a stale record only costs extra conflict lookups
            log.warn("Reconciliation before provisioning skipped for tenant {}: {}", credential.getTenantId(), e.getMessage());
        }
    }

    private PartialSuccessReport run(ProvisioningPhase phase, BusinessProfile profile,
                                     ProviderCredential credential, List<Branch> branches) {
        Instant startedAt = Instant.now();
        RunContext context = new RunContext(profile, credential,
                providerRegistry.adapterFor(credential.getProvider()), properties.getProvider().getCallTimeout());

        List<CompletableFuture<BranchOutcome>> futures = branches.stream()
                .map(branch -> CompletableFuture.supplyAsync(() -> processBranch(context, branch), provisioningExecutor))
                .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            context.aborted.set(true);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AuthException) {
                credentialService.markRejected(credential);
                log.error("Aborted {} run for tenant {}: {}", phase, credential.getTenantId(), cause.getMessage());
                throw (AuthException) cause;
            }
            log.error("{} run for tenant {} failed: {}", phase, credential.getTenantId(), cause.getMessage(), cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Provisioning run failed for tenant " + credential.getTenantId(), cause);
        }

        List<String> created = new ArrayList<>();
        List<String> alreadyExisted = new ArrayList<>();
        List<FailedFolder> failed = new ArrayList<>();
        for (CompletableFuture<BranchOutcome> future : futures) {
            BranchOutcome outcome = future.join();
            created.addAll(outcome.created);
            alreadyExisted.addAll(outcome.alreadyExisted);
            failed.addAll(outcome.failed);
        }
        PartialSuccessReport report = PartialSuccessReport.builder()
                .tenantId(credential.getTenantId())
                .provider(credential.getProvider())
                .phase(phase)
                .created(Collections.unmodifiableList(created))
                .alreadyExisted(Collections.unmodifiableList(alreadyExisted))
                .failed(Collections.unmodifiableList(failed))
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .build();
        log.info("{} run for tenant {} on {}: {} created, {} already existed, {} failed",
                phase, credential.getTenantId(), credential.getProvider(),
                created.size(), alreadyExisted.size(), failed.size());
        return report;
    }

    private BranchOutcome processBranch(RunContext context, Branch branch) {
        BranchOutcome outcome = new BranchOutcome();
        visit(context, branch, branch.root, null, outcome);
        return outcome;
    }

    private void visit(RunContext context, Branch branch, FolderSpec node, String parentRef, BranchOutcome outcome) {
        if (context.aborted.get() || !branch.shouldVisit(node)) {
            return;
        }
        String id;
        try {
            id = branch.isTarget(node)
                    ? ensure(context, node, parentRef, outcome)
                    : locate(context, branch, node, parentRef, outcome);
        } catch (AuthException e) {
            context.aborted.set(true);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error provisioning folder '{}' for tenant {}: {}",
                    node.path(), context.credential.getTenantId(), e.getMessage(), e);
            outcome.failed.add(new FailedFolder(node.path(), "Unexpected error"));
            id = null;
        }

        if (id == null) {
            String reason = "Parent folder '" + node.path() + "' could not be provisioned";
            node.flatten().skip(1)
                    .filter(branch::isTarget)
                    .forEach(descendant -> outcome.failed.add(new FailedFolder(descendant.path(), reason)));
            return;
        }
        for (FolderSpec child : node.getChildren()) {
            visit(context, branch, child, id, outcome);
        }
    }

    /**
     * Create-or-resolve for one node. Returns the provider id, or null after recording a failure.
     */
    private String ensure(RunContext context, FolderSpec node, String parentRef, BranchOutcome outcome) {
        FolderRequest request = FolderRequest.of(node, parentRef);
        FolderProviderAdapter adapter = context.adapter;

        ProviderResult<CreatedFolder> created = adapter.create(context.credential, request, context.timeout);
        if (!created.isOk()) {
            return fail(context, node, created, outcome);
        }
        boolean existed = created.getValue().isConflict();
        String id = created.getValue().getId();
        if (existed) {
            ProviderResult<Optional<String>> resolved = adapter.resolveByName(context.credential, request, context.timeout);
            if (!resolved.isOk()) {
                return fail(context, node, resolved, outcome);
            }
            if (resolved.getValue().isEmpty()) {
                log.warn("Folder '{}' was reported as existing for tenant {} but could not be found",
                        node.path(), context.credential.getTenantId());
                outcome.failed.add(new FailedFolder(node.path(), "Folder reported as existing but could not be found"));
                return null;
            }
            id = resolved.getValue().get();
            log.info("Folder '{}' already existed for tenant {}, using id {}", node.path(), context.credential.getTenantId(), id);
        } else if (id == null) {
            outcome.failed.add(new FailedFolder(node.path(), "Provider returned no folder id"));
            return null;
        }

        folderRecordService.upsert(context.profile, adapter.provider(), adapter.toRemoteFolder(id, request), Instant.now());
        if (existed) {
            outcome.alreadyExisted.add(node.path());
        } else {
            outcome.created.add(node.path());
        }
        return id;
    }

    /**
     * Finds an ancestor of a target node without changing it; creates it only if it is gone.
     * A recreated ancestor gets its core subfolders back as well.
     */
    private String locate(RunContext context, Branch branch, FolderSpec node, String parentRef, BranchOutcome outcome) {
        FolderRequest request = FolderRequest.of(node, parentRef);
        ProviderResult<Optional<String>> found = context.adapter.resolveByName(context.credential, request, context.timeout);
        if (!found.isOk()) {
            return fail(context, node, found, outcome);
        }
        if (found.getValue().isPresent()) {
            return found.getValue().get();
        }
        log.info("Folder '{}' is missing for tenant {}, recreating it", node.path(), context.credential.getTenantId());
        String id = ensure(context, node, parentRef, outcome);
        if (id != null) {
            branch.addCoreDescendants(node);
        }
        return id;
    }

    private String fail(RunContext context, FolderSpec node, ProviderResult<?> result, BranchOutcome outcome) {
        if (result.getErrorKind() == ProviderErrorKind.AUTH) {
            throw new AuthException("Mail provider rejected the credential while provisioning '" + node.path() + "'");
        }
        log.warn("Could not provision folder '{}' for tenant {}: {}",
                node.path(), context.credential.getTenantId(), result.getMessage());
        String reason = result.getErrorKind() == ProviderErrorKind.TRANSIENT
                ? "Provider unavailable after retries"
                : "Provider rejected the folder";
        outcome.failed.add(new FailedFolder(node.path(), reason));
        return null;
    }

    private static FolderSpec rootOf(FolderSpec node) {
        FolderSpec current = node;
        while (current.getParent() != null) {
            current = current.getParent();
        }
        return current;
    }

    private static final class Branch {
        private final FolderSpec root;
        // Path keys to provision; null means the whole branch
        private final Set<String> targets;

        private Branch(FolderSpec root, Set<String> targets) {
            this.root = root;
            this.targets = targets;
        }

        private boolean isTarget(FolderSpec node) {
            return targets == null || targets.contains(node.pathKey());
        }

        private void addCoreDescendants(FolderSpec node) {
            if (targets != null) {
                node.flatten().skip(1)
                        .filter(n -> !n.isDynamic())
                        .forEach(n -> targets.add(n.pathKey()));
            }
        }

        private boolean shouldVisit(FolderSpec node) {
            return targets == null || node.flatten().anyMatch(n -> targets.contains(n.pathKey()));
        }
    }

    private static final class RunContext {
        private final BusinessProfile profile;
        private final ProviderCredential credential;
        private final FolderProviderAdapter adapter;
        private final Duration timeout;
        private final AtomicBoolean aborted = new AtomicBoolean(false);

        private RunContext(BusinessProfile profile, ProviderCredential credential,
                           FolderProviderAdapter adapter, Duration timeout) {
            this.profile = profile;
            this.credential = credential;
            this.adapter = adapter;
            this.timeout = timeout;
        }
    }

    private static final class BranchOutcome {
        private final List<String> created = new ArrayList<>();
        private final List<String> alreadyExisted = new ArrayList<>();
        private final List<FailedFolder> failed = new ArrayList<>();
    }
}
