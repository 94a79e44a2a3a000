package mail.taxonomy.app.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BaseTaxonomy {
    private String version;
    private List<String> provisioningOrder = new ArrayList<>();
    private List<FolderTemplate> categories = new ArrayList<>();
}
