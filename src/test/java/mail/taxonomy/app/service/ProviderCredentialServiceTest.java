package mail.taxonomy.app.service;

import mail.taxonomy.app.entity.AccessGrant;
import mail.taxonomy.app.entity.MailAccount;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.entity.SyncStatus;
import mail.taxonomy.app.exception.AuthException;
import mail.taxonomy.app.provider.ProviderCredential;
import mail.taxonomy.app.repository.MailAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderCredentialServiceTest {

    @Mock
    private MailAccountRepository mailAccountRepository;

    @InjectMocks
    private ProviderCredentialService credentialService;

    private MailAccount testAccount;
    private AccessGrant testGrant;

    @BeforeEach
    void setUp() {
        testGrant = new AccessGrant();
        testGrant.setAccessToken("access_token_123");
        testGrant.setExpiresAt(Instant.now().plusSeconds(3600));
        testGrant.setScopes("https://www.googleapis.com/auth/gmail.labels");

        testAccount = new MailAccount();
        testAccount.setId("account123");
        testAccount.setTenantId("tenant123");
        testAccount.setProvider(MailProvider.GMAIL);
        testAccount.setEmailAddress("test@example.com");
        testAccount.setActive(true);
        testAccount.setSyncStatus(SyncStatus.ACTIVE);
        testAccount.setGrant(testGrant);
    }

    @Test
    void resolve_WithValidToken_ShouldReturnCredential() {
        // Given
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When
        ProviderCredential credential = credentialService.resolve("tenant123");

        // Then
        assertEquals("access_token_123", credential.getAccessToken());
        assertEquals(MailProvider.GMAIL, credential.getProvider());
        assertEquals("test@example.com", credential.getMailbox());
        assertFalse(credential.toString().contains("access_token_123"));
        verify(mailAccountRepository, never()).save(any(MailAccount.class));
    }

    @Test
    void resolve_WithNoAccount_ShouldThrowAuthException() {
        // Given
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.empty());

        // When & Then
        AuthException exception = assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));
        assertTrue(exception.getMessage().contains("tenant123"));
    }

    @Test
    void resolve_WithExpiringToken_ShouldThrowWithoutFlaggingAccount() {
        // Given
        testGrant.setExpiresAt(Instant.now().plusSeconds(30)); // Inside the skew
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When & Then
        assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));
        assertEquals(SyncStatus.ACTIVE, testAccount.getSyncStatus());
        verify(mailAccountRepository, never()).save(any(MailAccount.class));
    }

    @Test
    void resolve_AfterTokenIsRefreshed_ShouldSucceed() {
        // Given
        testGrant.setExpiresAt(Instant.now().plusSeconds(30));
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));
        assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));

        // When
        testGrant.setAccessToken("access_token_456");
        testGrant.setExpiresAt(Instant.now().plusSeconds(3600));
        ProviderCredential credential = credentialService.resolve("tenant123");

        // Then
        assertEquals("access_token_456", credential.getAccessToken());
    }

    @Test
    void resolve_AfterRejectedTokenIsReplaced_ShouldClearExpiredFlag() {
        // Given
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));
        credentialService.markRejected(new ProviderCredential("tenant123", MailProvider.GMAIL, "access_token_123", "test@example.com"));
        assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));

        // When
        testGrant.setAccessToken("access_token_456");
        ProviderCredential credential = credentialService.resolve("tenant123");

        // Then
        assertEquals("access_token_456", credential.getAccessToken());
        assertEquals(SyncStatus.ACTIVE, testAccount.getSyncStatus());
        assertNull(testAccount.getRejectedTokenFingerprint());
    }

    @Test
    void resolve_WithExpiredStatusFromOAuthCollaborator_ShouldRequireReconnect() {
        // Given
        testAccount.setSyncStatus(SyncStatus.EXPIRED);
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When & Then
        assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));
        verify(mailAccountRepository, never()).save(any(MailAccount.class));
    }

    @Test
    void resolve_WithMissingToken_ShouldThrowAuthException() {
        // Given
        testGrant.setAccessToken(" ");
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When & Then
        assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));
    }

    @Test
    void resolve_WithFlaggedAccount_ShouldRequireReconnect() {
        // Given
        testAccount.setSyncStatus(SyncStatus.ERROR);
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When & Then
        AuthException exception = assertThrows(AuthException.class, () -> credentialService.resolve("tenant123"));
        assertTrue(exception.getMessage().contains("reconnected"));
    }

    @Test
    void markRejected_ShouldFlagMatchingAccountOnly() {
        // Given
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When
        credentialService.markRejected(new ProviderCredential("tenant123", MailProvider.OUTLOOK, "access_token_123", "test@example.com"));
        credentialService.markRejected(new ProviderCredential("tenant123", MailProvider.GMAIL, "access_token_123", "test@example.com"));

        // Then
        verify(mailAccountRepository, times(1)).save(testAccount);
        assertEquals(SyncStatus.EXPIRED, testAccount.getSyncStatus());
        assertNotNull(testAccount.getRejectedTokenFingerprint());
    }

    @Test
    void markRejected_WhenTokenWasRefreshedMidRun_ShouldLeaveAccountActive() {
        // Given
        when(mailAccountRepository.findFirstByTenantIdAndActiveTrue("tenant123")).thenReturn(Optional.of(testAccount));

        // When
        credentialService.markRejected(new ProviderCredential("tenant123", MailProvider.GMAIL, "stale_token", "test@example.com"));

        // Then
        verify(mailAccountRepository, never()).save(any(MailAccount.class));
        assertEquals(SyncStatus.ACTIVE, testAccount.getSyncStatus());
    }
}
