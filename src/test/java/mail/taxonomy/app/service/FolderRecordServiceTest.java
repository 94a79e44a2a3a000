package mail.taxonomy.app.service;

import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import mail.taxonomy.app.provider.RemoteFolder;
import mail.taxonomy.app.repository.ProviderFolderRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FolderRecordServiceTest {

    @Mock
    private ProviderFolderRecordRepository folderRecordRepository;

    @InjectMocks
    private FolderRecordService folderRecordService;

    private BusinessProfile profile;
    private InMemoryFolderRecords records;

    @BeforeEach
    void setUp() {
        profile = new BusinessProfile();
        profile.setId("profile-1");
        profile.setTenantId("tenant-1");
        records = InMemoryFolderRecords.backing(folderRecordRepository);
    }

    private static RemoteFolder folder(String id, String path) {
        return new RemoteFolder(id, path, null, path, null);
    }

    @Test
    void upsert_WithNewLabel_ShouldCreateRecord() {
        // When
        FolderRecordService.RecordChange change = folderRecordService.upsert(profile, MailProvider.GMAIL,
                new RemoteFolder("Label_1", "BANKING", null, "BANKING", "#16a766"), Instant.now());

        // Then
        assertEquals(FolderRecordService.RecordChange.CREATED, change);
        ProviderFolderRecord record = records.byPath("BANKING").orElseThrow();
        assertEquals("Label_1", record.getLabelId());
        assertEquals("#16a766", record.getColor());
        assertFalse(record.isDeleted());
    }

    @Test
    void upsert_WithKnownLabel_ShouldUpdateNameInPlace() {
        // Given
        Instant first = Instant.now().minusSeconds(60);
        folderRecordService.upsert(profile, MailProvider.GMAIL, folder("Label_1", "PROMO"), first);

        // When
        FolderRecordService.RecordChange change = folderRecordService.upsert(profile, MailProvider.GMAIL,
                folder("Label_1", "PROMOTIONS"), Instant.now());

        // Then
        assertEquals(FolderRecordService.RecordChange.UPDATED, change);
        assertEquals(1, records.size());
        assertEquals("PROMOTIONS", records.byPath("PROMOTIONS").orElseThrow().getLabelName());
    }

    @Test
    void upsert_WithOlderObservation_ShouldKeepNewerRecord() {
        // Given
        Instant newer = Instant.now();
        folderRecordService.upsert(profile, MailProvider.GMAIL, folder("Label_1", "SALES"), newer);

        // When
        FolderRecordService.RecordChange change = folderRecordService.upsert(profile, MailProvider.GMAIL,
                folder("Label_1", "SALES OLD"), newer.minusSeconds(5));

        // Then
        assertEquals(FolderRecordService.RecordChange.STALE, change);
        assertTrue(records.byPath("SALES").isPresent());
        assertEquals(newer, records.byPath("SALES").orElseThrow().getSyncedAt());
    }

    @Test
    void upsert_WithDeletedRecordSeenAgain_ShouldRestoreIt() {
        // Given
        Instant listedAt = Instant.now().minusSeconds(30);
        folderRecordService.upsert(profile, MailProvider.GMAIL, folder("Label_1", "MISC"), listedAt.minusSeconds(30));
        folderRecordService.markDeletedExcept(profile, MailProvider.GMAIL, Set.of(), listedAt);

        // When
        FolderRecordService.RecordChange change = folderRecordService.upsert(profile, MailProvider.GMAIL,
                folder("Label_1", "MISC"), Instant.now());

        // Then
        assertEquals(FolderRecordService.RecordChange.RESTORED, change);
        ProviderFolderRecord record = records.byPath("MISC").orElseThrow();
        assertFalse(record.isDeleted());
        assertNull(record.getDeletedAt());
    }

    @Test
    void upsert_WhenConcurrentInsertWins_ShouldFallBackToUpdate() {
        // Given
        ProviderFolderRecord winner = new ProviderFolderRecord();
        winner.setId("existing");
        winner.setBusinessProfile(profile);
        winner.setProvider(MailProvider.GMAIL);
        winner.setLabelId("Label_7");
        winner.setLabelName("URGENT");
        winner.setSyncedAt(Instant.now().minusSeconds(10));
        reset(folderRecordRepository);
        when(folderRecordRepository.findByBusinessProfileIdAndProviderAndLabelId("profile-1", MailProvider.GMAIL, "Label_7"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(folderRecordRepository.saveAndFlush(any(ProviderFolderRecord.class)))
                .thenThrow(new DataIntegrityViolationException("uk_folder_record_profile_provider_label"));

        // When
        FolderRecordService.RecordChange change = folderRecordService.upsert(profile, MailProvider.GMAIL,
                folder("Label_7", "URGENT"), Instant.now());

        // Then
        assertEquals(FolderRecordService.RecordChange.UPDATED, change);
        verify(folderRecordRepository).save(winner);
    }

    @Test
    void markDeletedExcept_ShouldSoftDeleteOnlyUnobservedOlderRecords() {
        // Given
        Instant listedAt = Instant.now();
        folderRecordService.upsert(profile, MailProvider.GMAIL, folder("Label_1", "SALES"), listedAt.minusSeconds(60));
        folderRecordService.upsert(profile, MailProvider.GMAIL, folder("Label_2", "Old Folder"), listedAt.minusSeconds(60));
        folderRecordService.upsert(profile, MailProvider.GMAIL, folder("Label_3", "Just Created"), listedAt.plusSeconds(1));

        // When
        int marked = folderRecordService.markDeletedExcept(profile, MailProvider.GMAIL, Set.of("Label_1"), listedAt);

        // Then
        assertEquals(1, marked);
        ProviderFolderRecord old = records.byPath("Old Folder").orElseThrow();
        assertTrue(old.isDeleted());
        assertEquals(listedAt, old.getDeletedAt());
        assertFalse(records.byPath("Just Created").orElseThrow().isDeleted());
        assertFalse(records.byPath("SALES").orElseThrow().isDeleted());
        assertEquals(3, records.size());
    }
}
