package mail.taxonomy.app.entity;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeamMember {
    private String name;
    private String role;
    private String email;

    public TeamMember(String name) {
        this.name = name;
    }
}
