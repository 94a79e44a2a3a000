package mail.taxonomy.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Supplier {
    private String name;

    /**
     * Comma separated sender domains, e.g. "poolcorp.com,scp.com".
     */
    @Column(length = 1000)
    private String domains;

    public Supplier(String name) {
        this.name = name;
    }

    public List<String> getDomainList() {
        if (domains == null || domains.isBlank()) {
            return List.of();
        }
        return Arrays.stream(domains.split(","))
                .map(String::trim)
                .filter(d -> !d.isEmpty())
                .collect(Collectors.toList());
    }
}
