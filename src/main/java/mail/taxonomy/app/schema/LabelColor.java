package mail.taxonomy.app.schema;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Label color pair as accepted by Gmail's label palette.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabelColor {
    private String backgroundColor;
    private String textColor;
}
