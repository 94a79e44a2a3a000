package mail.taxonomy.app.repository;

import mail.taxonomy.app.entity.MailAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MailAccountRepository extends JpaRepository<MailAccount, String> {
    Optional<MailAccount> findFirstByTenantIdAndActiveTrue(String tenantId);

    List<MailAccount> findByActiveTrue();
}
