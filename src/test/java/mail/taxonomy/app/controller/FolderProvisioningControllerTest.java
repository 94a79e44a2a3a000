package mail.taxonomy.app.controller;

import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.exception.AuthException;
import mail.taxonomy.app.exception.FoldersNotProvisionedException;
import mail.taxonomy.app.exception.ProviderUnavailableException;
import mail.taxonomy.app.exception.SchemaException;
import mail.taxonomy.app.exception.TenantBusyException;
import mail.taxonomy.app.model.FailedFolder;
import mail.taxonomy.app.model.PartialSuccessReport;
import mail.taxonomy.app.model.ProvisioningPhase;
import mail.taxonomy.app.model.RoutingTable;
import mail.taxonomy.app.service.FolderHealthService;
import mail.taxonomy.app.service.FolderProvisioningService;
import mail.taxonomy.app.service.FolderReconciliationService;
import mail.taxonomy.app.service.RoutingTableService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class FolderProvisioningControllerTest {

    @Mock
    private FolderProvisioningService provisioningService;

    @Mock
    private FolderReconciliationService reconciliationService;

    @Mock
    private FolderHealthService healthService;

    @Mock
    private RoutingTableService routingTableService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                new FolderProvisioningController(provisioningService, reconciliationService, healthService),
                new RoutingTableController(routingTableService)).build();
    }

    @Test
    void provisionSkeleton_WithPartialFailure_ShouldReturnReportWithStatus() throws Exception {
        // Given
        PartialSuccessReport report = PartialSuccessReport.builder()
                .tenantId("tenant-1")
                .provider(MailProvider.GMAIL)
                .phase(ProvisioningPhase.SKELETON)
                .created(List.of("BANKING", "BANKING/Invoice"))
                .alreadyExisted(List.of())
                .failed(List.of(new FailedFolder("MISC", "Provider unavailable after retries")))
                .build();
        when(provisioningService.provisionSkeleton("tenant-1", "Pools & Spas")).thenReturn(report);

        // When / Then
        mockMvc.perform(post("/api/tenants/tenant-1/folders/skeleton")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"businessType\":\"Pools & Spas\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PARTIAL"))
                .andExpect(jsonPath("$.totalNodes").value(3))
                .andExpect(jsonPath("$.failed[0].path").value("MISC"));
    }

    @Test
    void provisionSkeleton_WithUnknownBusinessType_ShouldReturn422() throws Exception {
        // Given
        when(provisioningService.provisionSkeleton("tenant-1", "Space Mining"))
                .thenThrow(new SchemaException("Unknown business type: Space Mining"));

        // When / Then
        mockMvc.perform(post("/api/tenants/tenant-1/folders/skeleton")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"businessType\":\"Space Mining\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Unknown business type: Space Mining"));
    }

    @Test
    void injectTeamFolders_WhenTokenExpired_ShouldAskToReconnect() throws Exception {
        // Given
        when(provisioningService.injectTeamFolders("tenant-1"))
                .thenThrow(new AuthException("Gmail rejected the credential: HTTP 401 authError"));

        // When / Then
        mockMvc.perform(post("/api/tenants/tenant-1/folders/team"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Reconnect your email account"));
    }

    @Test
    void reconcile_WhenTenantBusy_ShouldReturnConflict() throws Exception {
        // Given
        when(reconciliationService.reconcile("tenant-1")).thenThrow(new TenantBusyException("tenant-1"));

        // When / Then
        mockMvc.perform(post("/api/tenants/tenant-1/folders/reconcile"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("already running")));
    }

    @Test
    void checkHealth_WhenProviderDown_ShouldNotLeakProviderDetails() throws Exception {
        // Given
        when(healthService.checkHealth("tenant-1"))
                .thenThrow(new ProviderUnavailableException("Outlook list folders: HTTP 503 ServiceUnavailable"));

        // When / Then
        mockMvc.perform(get("/api/tenants/tenant-1/folders/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", containsString("not responding")));
    }

    @Test
    void buildRoutingTable_ShouldReturnCategories() throws Exception {
        // Given
        when(routingTableService.buildRoutingTable("tenant-1")).thenReturn(new RoutingTable("tenant-1",
                MailProvider.GMAIL, Map.of("banking", List.of("Label_2", "Label_3")), null));

        // When / Then
        mockMvc.perform(get("/api/tenants/tenant-1/routing-table"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.banking[1]").value("Label_3"));
    }

    @Test
    void buildRoutingTable_WithoutFolders_ShouldReturnConflict() throws Exception {
        // Given
        when(routingTableService.buildRoutingTable("tenant-1")).thenThrow(new FoldersNotProvisionedException("tenant-1"));

        // When / Then
        mockMvc.perform(get("/api/tenants/tenant-1/routing-table"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Folders have not been provisioned"));
    }
}
