package mail.taxonomy.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tenant business profile maintained by onboarding. The engine reads business
 * types, team members and suppliers from it and owns the folder records hanging off it.
 */
@Entity
@Table(name = "business_profiles")
@Getter
@Setter
@ToString(exclude = {"teamMembers", "suppliers"})
public class BusinessProfile {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "tenant_id", nullable = false, unique = true)
    private String tenantId;

    private String businessName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "business_profile_types", joinColumns = @JoinColumn(name = "business_profile_id"))
    @OrderColumn(name = "position")
    @Column(name = "business_type", nullable = false)
    private List<String> businessTypes = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "business_profile_team_members", joinColumns = @JoinColumn(name = "business_profile_id"))
    @OrderColumn(name = "position")
    private List<TeamMember> teamMembers = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "business_profile_suppliers", joinColumns = @JoinColumn(name = "business_profile_id"))
    @OrderColumn(name = "position")
    private List<Supplier> suppliers = new ArrayList<>();

    public List<String> teamMemberNames() {
        return teamMembers.stream().map(TeamMember::getName).collect(Collectors.toList());
    }

    public List<String> supplierNames() {
        return suppliers.stream().map(Supplier::getName).collect(Collectors.toList());
    }
}
