package mail.taxonomy.app.controller;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.exception.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Turns engine exceptions into user-facing responses. Provider payloads stay in the logs.
 */
@Slf4j
final class ApiErrorResponses {

    private ApiErrorResponses() {
    }

    static ResponseEntity<Map<String, String>> from(String tenantId, Exception e) {
        if (e instanceof AuthException) {
            log.warn("Auth failure for tenant {}: {}", tenantId, e.getMessage());
            return body(HttpStatus.UNAUTHORIZED, "Reconnect your email account");
        }
        if (e instanceof SchemaException) {
            return body(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        }
        if (e instanceof ProfileNotFoundException) {
            return body(HttpStatus.NOT_FOUND, e.getMessage());
        }
        if (e instanceof FoldersNotProvisionedException) {
            return body(HttpStatus.CONFLICT, "Folders have not been provisioned");
        }
        if (e instanceof TenantBusyException) {
            return body(HttpStatus.CONFLICT, "A folder update is already running for this account, try again shortly");
        }
        if (e instanceof ProviderUnavailableException) {
            log.warn("Provider unavailable for tenant {}: {}", tenantId, e.getMessage());
            return body(HttpStatus.SERVICE_UNAVAILABLE, "Your email provider is not responding, try again later");
        }
        log.error("Unexpected error for tenant {}: {}", tenantId, e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error, try again later");
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
