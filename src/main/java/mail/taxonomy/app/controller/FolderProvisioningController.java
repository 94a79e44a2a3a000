package mail.taxonomy.app.controller;

import mail.taxonomy.app.model.HealthReport;
import mail.taxonomy.app.model.PartialSuccessReport;
import mail.taxonomy.app.model.ReconciliationResult;
import mail.taxonomy.app.service.FolderHealthService;
import mail.taxonomy.app.service.FolderProvisioningService;
import mail.taxonomy.app.service.FolderReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Folder endpoints used by the onboarding UI.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/folders")
public class FolderProvisioningController {
    private final FolderProvisioningService provisioningService;
    private final FolderReconciliationService reconciliationService;
    private final FolderHealthService healthService;

    public FolderProvisioningController(
            FolderProvisioningService provisioningService,
            FolderReconciliationService reconciliationService,
            FolderHealthService healthService) {
        this.provisioningService = provisioningService;
        this.reconciliationService = reconciliationService;
        this.healthService = healthService;
    }

    /**
     * Creates the core folders for the chosen business type. Body: {@code {"businessType": "Pools & Spas"}}.
     */
    @PostMapping("/skeleton")
    public ResponseEntity<?> provisionSkeleton(@PathVariable String tenantId,
                                               @RequestBody Map<String, String> body) {
        try {
            PartialSuccessReport report = provisioningService.provisionSkeleton(tenantId, body.get("businessType"));
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            return ApiErrorResponses.from(tenantId, e);
        }
    }

    /**
     * Adds folders for the team members and suppliers saved on the business profile.
     */
    @PostMapping("/team")
    public ResponseEntity<?> injectTeamFolders(@PathVariable String tenantId) {
        try {
            PartialSuccessReport report = provisioningService.injectTeamFolders(tenantId);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            return ApiErrorResponses.from(tenantId, e);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<?> checkHealth(@PathVariable String tenantId) {
        try {
            HealthReport report = healthService.checkHealth(tenantId);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            return ApiErrorResponses.from(tenantId, e);
        }
    }

    @PostMapping("/reconcile")
    public ResponseEntity<?> reconcile(@PathVariable String tenantId) {
        try {
            ReconciliationResult result = reconciliationService.reconcile(tenantId);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            return ApiErrorResponses.from(tenantId, e);
        }
    }
}
