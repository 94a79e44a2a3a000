package mail.taxonomy.app.provider;

import lombok.Value;

/**
 * A folder as listed by the provider.
 */
@Value
public class RemoteFolder {
    String id;
    String name;
    String parentRef;
    String path;
    String color;
}
