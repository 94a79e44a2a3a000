package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.entity.AccessGrant;
import mail.taxonomy.app.entity.MailAccount;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.SyncStatus;
import mail.taxonomy.app.exception.AuthException;
import mail.taxonomy.app.provider.ProviderCredential;
import mail.taxonomy.app.repository.MailAccountRepository;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Hands out the bearer credential stored by the OAuth collaborator.
 * Tokens are never refreshed here: anything unusable is an {@link AuthException}
 * and the caller has to refresh the token (or reconnect the account) and retry.
 */
@Slf4j
@Service
public class ProviderCredentialService {
    private static final long EXPIRY_SKEW_SECONDS = 60;

    private final MailAccountRepository mailAccountRepository;

    public ProviderCredentialService(MailAccountRepository mailAccountRepository) {
        this.mailAccountRepository = mailAccountRepository;
    }

    /**
     * Returns a credential for the tenant's active mail account.
     * @throws AuthException if no account is connected, the account was flagged, or the token is missing or expiring
     */
    public ProviderCredential resolve(String tenantId) {
        MailAccount account = requireAccount(tenantId);
        AccessGrant grant = account.getGrant();
        if (grant == null || grant.getAccessToken() == null || grant.getAccessToken().isBlank()) {
            throw new AuthException("No access token available for account: " + account.getEmailAddress());
        }

        if (account.getSyncStatus() == SyncStatus.EXPIRED || account.getSyncStatus() == SyncStatus.ERROR) {
            if (!wasRefreshedSinceRejection(account, grant)) {
                throw new AuthException("Mail account " + account.getEmailAddress()
                        + " must be reconnected (status " + account.getSyncStatus() + ")");
            }
            log.info("Account {} has a new access token since it was rejected, clearing EXPIRED", account.getEmailAddress());
            account.setSyncStatus(SyncStatus.ACTIVE);
            account.setRejectedTokenFingerprint(null);
            mailAccountRepository.save(account);
        }

        // Expiring within the skew counts as expired; refreshing is the OAuth collaborator's job
        if (grant.getExpiresAt() == null || grant.getExpiresAt().isBefore(Instant.now().plusSeconds(EXPIRY_SKEW_SECONDS))) {
            throw new AuthException("Access token expired for account: " + account.getEmailAddress()
                    + ". Refresh the token and retry.");
        }

        return new ProviderCredential(tenantId, account.getProvider(), grant.getAccessToken(), account.getEmailAddress());
    }

    /**
     * Provider of the tenant's active account, without checking the token.
     */
    public MailProvider activeProvider(String tenantId) {
        return requireAccount(tenantId).getProvider();
    }

    /**
     * Flags the account after the provider rejected its credential mid-run.
     * Nothing is written if the stored token was replaced while the run was in flight.
     */
    public void markRejected(ProviderCredential credential) {
        mailAccountRepository.findFirstByTenantIdAndActiveTrue(credential.getTenantId())
                .filter(account -> account.getProvider() == credential.getProvider())
                .filter(account -> account.getGrant() != null
                        && credential.getAccessToken().equals(account.getGrant().getAccessToken()))
                .ifPresent(account -> {
                    account.setSyncStatus(SyncStatus.EXPIRED);
                    account.setRejectedTokenFingerprint(fingerprint(credential.getAccessToken()));
                    mailAccountRepository.save(account);
                    log.warn("Provider {} rejected the credential of account {}, marked EXPIRED",
                            credential.getProvider(), account.getEmailAddress());
                });
    }

    // Only an EXPIRED flag this engine wrote can be lifted, and only by a different token
    private static boolean wasRefreshedSinceRejection(MailAccount account, AccessGrant grant) {
        return account.getSyncStatus() == SyncStatus.EXPIRED
                && account.getRejectedTokenFingerprint() != null
                && !account.getRejectedTokenFingerprint().equals(fingerprint(grant.getAccessToken()));
    }

    private static String fingerprint(String accessToken) {
        return DigestUtils.md5DigestAsHex(accessToken.getBytes(StandardCharsets.UTF_8));
    }

    private MailAccount requireAccount(String tenantId) {
        return mailAccountRepository.findFirstByTenantIdAndActiveTrue(tenantId)
                .orElseThrow(() -> new AuthException("No connected mail account for tenant: " + tenantId));
    }
}
