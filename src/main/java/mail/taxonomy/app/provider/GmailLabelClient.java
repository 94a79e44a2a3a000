package mail.taxonomy.app.provider;

import com.google.api.services.gmail.model.Label;

import java.io.IOException;
import java.util.List;

/**
 * Thin wrapper around the Gmail labels API.
 */
public interface GmailLabelClient {

    /**
     * Lists all labels of the mailbox, system labels included.
     * @throws ProviderApiException if Gmail answers with an error status
     * @throws IOException on network failure
     */
    List<Label> listLabels(String accessToken) throws IOException;

    /**
     * Creates a label and returns it with its Gmail id.
     * @throws ProviderApiException if Gmail answers with an error status (409 when the name is taken)
     * @throws IOException on network failure
     */
    Label createLabel(String accessToken, Label label) throws IOException;
}
