package mail.taxonomy.app.provider;

import lombok.ToString;
import lombok.Value;
import mail.taxonomy.app.entity.MailProvider;

/**
 * Bearer credential for one tenant mailbox, passed explicitly into every provider call.
 */
@Value
public class ProviderCredential {
    String tenantId;
    MailProvider provider;
    @ToString.Exclude
    String accessToken;
    String mailbox;
}
