package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import mail.taxonomy.app.provider.RemoteFolder;
import mail.taxonomy.app.repository.ProviderFolderRecordRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes to the local folder record. Every write is an upsert keyed by
 * (business profile, provider, label id); the newest observation wins.
 */
@Slf4j
@Service
public class FolderRecordService {
    private final ProviderFolderRecordRepository folderRecordRepository;

    public FolderRecordService(ProviderFolderRecordRepository folderRecordRepository) {
        this.folderRecordRepository = folderRecordRepository;
    }

    public enum RecordChange {
        CREATED,
        UPDATED,
        RESTORED,
        /** A newer observation had already been written. */
        STALE
    }

    public List<ProviderFolderRecord> activeRecords(BusinessProfile profile, MailProvider provider) {
        return folderRecordRepository.findByBusinessProfileIdAndProviderAndDeletedFalse(profile.getId(), provider);
    }

    public RecordChange upsert(BusinessProfile profile, MailProvider provider, RemoteFolder folder, Instant observedAt) {
        Optional<ProviderFolderRecord> existing =
                folderRecordRepository.findByBusinessProfileIdAndProviderAndLabelId(profile.getId(), provider, folder.getId());
        if (existing.isPresent()) {
            return apply(existing.get(), folder, observedAt);
        }

        ProviderFolderRecord record = new ProviderFolderRecord();
        record.setBusinessProfile(profile);
        record.setProvider(provider);
        record.setLabelId(folder.getId());
        record.setLabelName(folder.getName());
        record.setLabelPath(folder.getPath());
        record.setParentLabelId(folder.getParentRef());
        record.setColor(folder.getColor());
        record.setSyncedAt(observedAt);
        record.setDeleted(false);
        try {
            folderRecordRepository.saveAndFlush(record);
            return RecordChange.CREATED;
        } catch (DataIntegrityViolationException e) {
            // Another writer inserted the same label id first
            log.debug("Concurrent insert for label {} of profile {}, updating instead", folder.getId(), profile.getId());
            ProviderFolderRecord winner = folderRecordRepository
                    .findByBusinessProfileIdAndProviderAndLabelId(profile.getId(), provider, folder.getId())
                    .orElseThrow(() -> e);
            return apply(winner, folder, observedAt);
        }
    }

    /**
     * Soft-deletes every active record of the profile whose label id was not observed.
     * Records written after {@code listedAt} are left alone since the listing predates them.
     * @return number of records marked deleted
     */
    public int markDeletedExcept(BusinessProfile profile, MailProvider provider, Set<String> observedIds, Instant listedAt) {
        List<ProviderFolderRecord> missing = activeRecords(profile, provider).stream()
                .filter(r -> !observedIds.contains(r.getLabelId()))
                .filter(r -> r.getSyncedAt() == null || !r.getSyncedAt().isAfter(listedAt))
                .collect(Collectors.toList());
        for (ProviderFolderRecord record : missing) {
            record.setDeleted(true);
            record.setDeletedAt(listedAt);
            log.info("Folder '{}' ({}) no longer exists on {}, marked deleted",
                    record.effectivePath(), record.getLabelId(), provider);
        }
        if (!missing.isEmpty()) {
            folderRecordRepository.saveAll(missing);
        }
        return missing.size();
    }

    private RecordChange apply(ProviderFolderRecord record, RemoteFolder folder, Instant observedAt) {
        if (record.getSyncedAt() != null && record.getSyncedAt().isAfter(observedAt)) {
            return RecordChange.STALE;
        }
        boolean restored = record.isDeleted();
        record.setLabelName(folder.getName());
        record.setLabelPath(folder.getPath());
        record.setParentLabelId(folder.getParentRef());
        if (folder.getColor() != null) {
            record.setColor(folder.getColor());
        }
        record.setSyncedAt(observedAt);
        record.setDeleted(false);
        record.setDeletedAt(null);
        folderRecordRepository.save(record);
        return restored ? RecordChange.RESTORED : RecordChange.UPDATED;
    }
}
