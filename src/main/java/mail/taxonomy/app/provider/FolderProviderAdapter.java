package mail.taxonomy.app.provider;

import mail.taxonomy.app.entity.MailProvider;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Provider-agnostic folder operations. One implementation per {@link MailProvider};
 * callers never branch on the provider's hierarchy model.
 * Every call retries transient failures with the provider's own policy and
 * reports "already exists" as a successful {@link CreatedFolder#isConflict() conflict}.
 */
public interface FolderProviderAdapter {

    MailProvider provider();

    /**
     * Creates the folder described by {@code request}.
     * @param timeout upper bound for each remote attempt
     * @return the created folder, or a conflict if a folder with that name already exists under the parent
     */
    ProviderResult<CreatedFolder> create(ProviderCredential credential, FolderRequest request, Duration timeout);

    /**
     * Lists every user-managed folder in the mailbox, parents before children.
     */
    ProviderResult<List<RemoteFolder>> list(ProviderCredential credential, Duration timeout);

    /**
     * Looks up the provider id of an existing folder by name under {@code request.parentRef}.
     * @return the id, or empty if no such folder exists
     */
    ProviderResult<Optional<String>> resolveByName(ProviderCredential credential, FolderRequest request, Duration timeout);

    /**
     * The folder as a later {@link #list} would report it, for a folder confirmed under {@code id}.
     */
    RemoteFolder toRemoteFolder(String id, FolderRequest request);
}
