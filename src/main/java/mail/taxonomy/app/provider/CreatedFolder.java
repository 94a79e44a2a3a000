package mail.taxonomy.app.provider;

import lombok.Value;

/**
 * Outcome of a create call. When {@code conflict} is true the folder already existed;
 * {@code id} is then only set if the provider returned the existing id with the conflict.
 */
@Value
public class CreatedFolder {
    String id;
    boolean conflict;

    public static CreatedFolder created(String id) {
        return new CreatedFolder(id, false);
    }

    public static CreatedFolder alreadyExists(String existingId) {
        return new CreatedFolder(existingId, true);
    }
}
