package mail.taxonomy.app.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Microsoft Graph client built on RestTemplate.
 */
@Slf4j
public class RestGraphMailFolderClient implements GraphMailFolderClient {
    private static final int PAGE_SIZE = 100;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public RestGraphMailFolderClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<GraphMailFolder> listFolders(String accessToken, String parentId) {
        String url = parentId == null
                ? baseUrl + "/mailFolders?$top=" + PAGE_SIZE
                : baseUrl + "/mailFolders/" + parentId + "/childFolders?$top=" + PAGE_SIZE;

        List<GraphMailFolder> folders = new ArrayList<>();
        while (url != null) {
            JsonNode page = exchange(URI.create(url), HttpMethod.GET, new HttpEntity<>(headers(accessToken)));
            for (JsonNode node : page.path("value")) {
                folders.add(toFolder(node));
            }
            url = page.hasNonNull("@odata.nextLink") ? page.get("@odata.nextLink").asText() : null;
        }
        return folders;
    }

    @Override
    public GraphMailFolder createFolder(String accessToken, String parentId, String displayName) {
        String url = parentId == null
                ? baseUrl + "/mailFolders"
                : baseUrl + "/mailFolders/" + parentId + "/childFolders";
        HttpHeaders headers = headers(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(Map.of("displayName", displayName), headers);
        return toFolder(exchange(URI.create(url), HttpMethod.POST, request));
    }

    private HttpHeaders headers(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private JsonNode exchange(URI uri, HttpMethod method, HttpEntity<?> entity) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, method, entity, String.class);
            String body = response.getBody();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (HttpStatusCodeException e) {
            throw translate(e);
        } catch (JsonProcessingException e) {
            throw new ProviderApiException(502, "InvalidResponse", "Unreadable Graph response: " + e.getOriginalMessage(), e);
        }
    }

    private GraphMailFolder toFolder(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, GraphMailFolder.class);
        } catch (JsonProcessingException e) {
            throw new ProviderApiException(502, "InvalidResponse", "Unreadable Graph mailFolder: " + e.getOriginalMessage(), e);
        }
    }

    private ProviderApiException translate(HttpStatusCodeException e) {
        String code = null;
        String message = e.getStatusText();
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString()).path("error");
            if (error.hasNonNull("code")) {
                code = error.get("code").asText();
            }
            if (error.hasNonNull("message")) {
                message = error.get("message").asText();
            }
        } catch (JsonProcessingException parseError) {
            log.debug("Graph error body was not JSON: {}", parseError.getOriginalMessage());
        }
        return new ProviderApiException(e.getStatusCode().value(), code, message, e);
    }
}
