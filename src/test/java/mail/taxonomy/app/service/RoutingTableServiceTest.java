package mail.taxonomy.app.service;

import mail.taxonomy.app.config.TaxonomyProperties;
import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import mail.taxonomy.app.exception.FoldersNotProvisionedException;
import mail.taxonomy.app.exception.ProviderUnavailableException;
import mail.taxonomy.app.model.RoutingTable;
import mail.taxonomy.app.provider.ProviderCredential;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoutingTableServiceTest {
    private static final String TENANT = "tenant-9";

    @Mock
    private BusinessProfileService businessProfileService;

    @Mock
    private ProviderCredentialService credentialService;

    @Mock
    private FolderReconciliationService reconciliationService;

    @Mock
    private FolderRecordService folderRecordService;

    @Mock
    private TenantRunLockService runLockService;

    private RoutingTableService routingTableService;
    private BusinessProfile profile;
    private ProviderCredential credential;

    @BeforeEach
    void setUp() {
        routingTableService = new RoutingTableService(businessProfileService, credentialService, reconciliationService,
                folderRecordService, runLockService, new RoutingTableBuilder(new TaxonomyProperties()));
        profile = new BusinessProfile();
        profile.setId("profile-9");
        profile.setTenantId(TENANT);
        credential = new ProviderCredential(TENANT, MailProvider.GMAIL, "token", "owner@example.com");

        when(businessProfileService.requireProfile(TENANT)).thenReturn(profile);
        when(runLockService.runExclusively(eq(TENANT), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
        when(credentialService.resolve(TENANT)).thenReturn(credential);
    }

    private ProviderFolderRecord record(String labelId, String path) {
        ProviderFolderRecord record = new ProviderFolderRecord();
        record.setBusinessProfile(profile);
        record.setProvider(MailProvider.GMAIL);
        record.setLabelId(labelId);
        record.setLabelName(path);
        record.setLabelPath(path);
        record.setSyncedAt(Instant.now());
        return record;
    }

    @Test
    void buildRoutingTable_ShouldReconcileBeforeReadingRecords() {
        // Given
        when(folderRecordService.activeRecords(profile, MailProvider.GMAIL))
                .thenReturn(List.of(record("Label_1", "URGENT"), record("Label_2", "URGENT/Leak Emergencies")));

        // When
        RoutingTable table = routingTableService.buildRoutingTable(TENANT);

        // Then
        verify(reconciliationService).reconcile(profile, credential);
        assertEquals(List.of("Label_2"), table.idsFor("urgent"));
        assertEquals(MailProvider.GMAIL, table.getProvider());
    }

    @Test
    void buildRoutingTable_WhenProviderIsDown_ShouldUseLastReconciledRecords() {
        // Given
        when(reconciliationService.reconcile(profile, credential))
                .thenThrow(new ProviderUnavailableException("Gmail list labels gave up"));
        when(folderRecordService.activeRecords(profile, MailProvider.GMAIL))
                .thenReturn(List.of(record("Label_1", "SALES")));

        // When
        RoutingTable table = routingTableService.buildRoutingTable(TENANT);

        // Then
        assertEquals(List.of("Label_1"), table.idsFor("sales"));
    }

    @Test
    void buildRoutingTable_WithNoFolders_ShouldSignalNotProvisioned() {
        // Given
        when(folderRecordService.activeRecords(profile, MailProvider.GMAIL)).thenReturn(List.of());

        // When & Then
        assertThrows(FoldersNotProvisionedException.class, () -> routingTableService.buildRoutingTable(TENANT));
    }
}
