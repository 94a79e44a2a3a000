package mail.taxonomy.app.provider;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

@Component
public class GoogleGmailLabelClient implements GmailLabelClient {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Mail Taxonomy Provisioner";
    private static final String USER_ID = "me";

    private final NetHttpTransport httpTransport;

    public GoogleGmailLabelClient() throws GeneralSecurityException, IOException {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
    }

    private Gmail gmail(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    @Override
    public List<Label> listLabels(String accessToken) throws IOException {
        try {
            ListLabelsResponse response = gmail(accessToken).users().labels().list(USER_ID).execute();
            return response.getLabels() != null ? response.getLabels() : new ArrayList<>();
        } catch (GoogleJsonResponseException e) {
            throw translate(e);
        }
    }

    @Override
    public Label createLabel(String accessToken, Label label) throws IOException {
        try {
            return gmail(accessToken).users().labels().create(USER_ID, label).execute();
        } catch (GoogleJsonResponseException e) {
            throw translate(e);
        }
    }

    private static ProviderApiException translate(GoogleJsonResponseException e) {
        GoogleJsonError details = e.getDetails();
        String reason = null;
        String message = e.getStatusMessage();
        if (details != null) {
            message = details.getMessage();
            if (details.getErrors() != null && !details.getErrors().isEmpty()) {
                reason = details.getErrors().get(0).getReason();
            }
        }
        return new ProviderApiException(e.getStatusCode(), reason, message, e);
    }
}
