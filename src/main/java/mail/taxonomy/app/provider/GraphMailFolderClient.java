package mail.taxonomy.app.provider;

import java.util.List;

/**
 * Microsoft Graph mailFolders endpoints.
 * Errors surface as {@link ProviderApiException}; connection failures as
 * {@link org.springframework.web.client.ResourceAccessException}.
 */
public interface GraphMailFolderClient {

    /**
     * Lists the direct children of {@code parentId}, or the mailbox root folders if it is null.
     * Follows paging links until the listing is complete.
     */
    List<GraphMailFolder> listFolders(String accessToken, String parentId);

    /**
     * Creates {@code displayName} under {@code parentId}, or at the root if it is null.
     */
    GraphMailFolder createFolder(String accessToken, String parentId, String displayName);
}
