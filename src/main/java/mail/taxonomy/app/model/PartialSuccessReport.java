package mail.taxonomy.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import mail.taxonomy.app.entity.MailProvider;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one provisioning run. Folder paths are listed per outcome; a run with
 * any failed folder is PARTIAL and can simply be re-run.
 */
@Value
@Builder
public class PartialSuccessReport {
    String tenantId;
    MailProvider provider;
    ProvisioningPhase phase;
    List<String> created;
    List<String> alreadyExisted;
    List<FailedFolder> failed;
    Instant startedAt;
    Instant finishedAt;

    @JsonProperty("totalNodes")
    public int getTotalNodes() {
        return created.size() + alreadyExisted.size() + failed.size();
    }

    @JsonProperty("status")
    public ProvisioningStatus getStatus() {
        return failed.isEmpty() ? ProvisioningStatus.COMPLETE : ProvisioningStatus.PARTIAL;
    }

    @JsonProperty("summary")
    public String summary() {
        int succeeded = created.size() + alreadyExisted.size();
        if (failed.isEmpty()) {
            return succeeded + " of " + getTotalNodes() + " folders created or confirmed";
        }
        return succeeded + " of " + getTotalNodes() + " folders created or confirmed, retry to finish the remaining "
                + failed.size();
    }
}
