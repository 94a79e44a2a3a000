package mail.taxonomy.app.model;

import lombok.Value;

@Value
public class FailedFolder {
    String path;
    String reason;
}
