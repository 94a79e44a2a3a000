package mail.taxonomy.app.service;

import mail.taxonomy.app.entity.BusinessProfile;
import mail.taxonomy.app.exception.ProfileNotFoundException;
import mail.taxonomy.app.exception.SchemaException;
import mail.taxonomy.app.repository.BusinessProfileRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to the business profiles maintained by onboarding.
 */
@Service
public class BusinessProfileService {
    private final BusinessProfileRepository businessProfileRepository;

    public BusinessProfileService(BusinessProfileRepository businessProfileRepository) {
        this.businessProfileRepository = businessProfileRepository;
    }

    public BusinessProfile requireProfile(String tenantId) {
        return businessProfileRepository.findByTenantId(tenantId)
                .orElseThrow(() -> new ProfileNotFoundException(tenantId));
    }

    public List<String> requireBusinessTypes(BusinessProfile profile) {
        if (profile.getBusinessTypes() == null || profile.getBusinessTypes().isEmpty()) {
            throw new SchemaException("No business type selected for tenant: " + profile.getTenantId());
        }
        return List.copyOf(profile.getBusinessTypes());
    }
}
