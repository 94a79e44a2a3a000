package mail.taxonomy.app.repository;

import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.ProviderFolderRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProviderFolderRecordRepository extends JpaRepository<ProviderFolderRecord, String> {
    Optional<ProviderFolderRecord> findByBusinessProfileIdAndProviderAndLabelId(
            String businessProfileId, MailProvider provider, String labelId);

    List<ProviderFolderRecord> findByBusinessProfileIdAndProvider(String businessProfileId, MailProvider provider);

    List<ProviderFolderRecord> findByBusinessProfileIdAndProviderAndDeletedFalse(
            String businessProfileId, MailProvider provider);
}
