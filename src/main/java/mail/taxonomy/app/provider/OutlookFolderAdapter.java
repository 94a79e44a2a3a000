package mail.taxonomy.app.provider;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.entity.MailProvider;
import mail.taxonomy.app.schema.FolderSpec;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.time.Duration;
import java.util.*;

/**
 * Outlook folders form a real tree: children are created under their parent's id and a
 * duplicate display name under the same parent comes back as ErrorFolderExists.
 */
@Slf4j
public class OutlookFolderAdapter implements FolderProviderAdapter {
    static final String FOLDER_EXISTS = "ErrorFolderExists";
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private final GraphMailFolderClient client;
    private final ProviderCallExecutor callExecutor;
    private final RetryPolicy retryPolicy;
    private final Set<String> systemFolders;

    public OutlookFolderAdapter(GraphMailFolderClient client, ProviderCallExecutor callExecutor,
                                RetryPolicy retryPolicy, Collection<String> systemFolders) {
        this.client = client;
        this.callExecutor = callExecutor;
        this.retryPolicy = retryPolicy;
        this.systemFolders = new HashSet<>();
        systemFolders.forEach(name -> this.systemFolders.add(name.toLowerCase(Locale.ROOT)));
    }

    @Override
    public MailProvider provider() {
        return MailProvider.OUTLOOK;
    }

    @Override
    public ProviderResult<CreatedFolder> create(ProviderCredential credential, FolderRequest request, Duration timeout) {
        return callExecutor.execute("Outlook create folder '" + request.getPath() + "'",
                () -> createFolder(credential, request),
                retryPolicy, timeout, OutlookFolderAdapter::classify);
    }

    @Override
    public ProviderResult<List<RemoteFolder>> list(ProviderCredential credential, Duration timeout) {
        List<RemoteFolder> folders = new ArrayList<>();
        Deque<RemoteFolder> pending = new ArrayDeque<>();
        pending.add(new RemoteFolder(null, null, null, null, null));

        while (!pending.isEmpty()) {
            RemoteFolder parent = pending.poll();
            String parentId = parent.getId();
            ProviderResult<List<GraphMailFolder>> children = callExecutor.execute(
                    "Outlook list folders under " + (parentId == null ? "root" : parent.getPath()),
                    () -> client.listFolders(credential.getAccessToken(), parentId),
                    retryPolicy, timeout, OutlookFolderAdapter::classify);
            if (!children.isOk()) {
                return children.castFailure();
            }
            for (GraphMailFolder child : children.getValue()) {
                if (child.hidden() || (parentId == null && isSystemFolder(child.getDisplayName()))) {
                    continue;
                }
                String path = parent.getPath() == null
                        ? child.getDisplayName()
                        : parent.getPath() + FolderSpec.PATH_SEPARATOR + child.getDisplayName();
                RemoteFolder folder = new RemoteFolder(child.getId(), child.getDisplayName(), child.getParentFolderId(), path, null);
                folders.add(folder);
                if (child.hasChildren()) {
                    pending.add(folder);
                }
            }
        }
        return ProviderResult.ok(folders);
    }

    @Override
    public ProviderResult<Optional<String>> resolveByName(ProviderCredential credential, FolderRequest request, Duration timeout) {
        return callExecutor.execute("Outlook resolve folder '" + request.getPath() + "'",
                        () -> client.listFolders(credential.getAccessToken(), request.getParentRef()),
                        retryPolicy, timeout, OutlookFolderAdapter::classify)
                .map(children -> children.stream()
                        .filter(f -> request.getName().equalsIgnoreCase(f.getDisplayName()))
                        .map(GraphMailFolder::getId)
                        .findFirst());
    }

    @Override
    public RemoteFolder toRemoteFolder(String id, FolderRequest request) {
        return new RemoteFolder(id, request.getName(), request.getParentRef(), request.getPath(), null);
    }

    private CreatedFolder createFolder(ProviderCredential credential, FolderRequest request) {
        try {
            GraphMailFolder created = client.createFolder(credential.getAccessToken(), request.getParentRef(), request.getName());
            log.debug("Created Outlook folder '{}' with id {}", request.getPath(), created.getId());
            return CreatedFolder.created(created.getId());
        } catch (ProviderApiException e) {
            if (isFolderExists(e)) {
                return CreatedFolder.alreadyExists(null);
            }
            throw e;
        }
    }

    static boolean isFolderExists(ProviderApiException e) {
        return e.getStatus() == 409 || FOLDER_EXISTS.equalsIgnoreCase(e.getErrorCode());
    }

    static ProviderErrorKind classify(Exception e) {
        if (e instanceof ProviderApiException) {
            int status = ((ProviderApiException) e).getStatus();
            if (status == 401 || status == 403) {
                return ProviderErrorKind.AUTH;
            }
            return TRANSIENT_STATUSES.contains(status) ? ProviderErrorKind.TRANSIENT : ProviderErrorKind.REJECTED;
        }
        if (e instanceof RestClientException || e instanceof IOException) {
            return ProviderErrorKind.TRANSIENT;
        }
        return ProviderErrorKind.REJECTED;
    }

    private boolean isSystemFolder(String displayName) {
        return displayName != null && systemFolders.contains(displayName.toLowerCase(Locale.ROOT));
    }
}
