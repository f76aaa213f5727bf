package atrium.core.model.privacy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import atrium.core.model.profile.AvailabilityOption;

/**
 * Public web view of a profile. Carries no contact address and no owner reference.
 */
public record PublicProfileView(
        String id,
        String slug,
        String name,
        String bio,
        String headline,
        String location,
        List<String> skills,
        Set<AvailabilityOption> availableFor,
        String linkedinUrl,
        Map<String, String> otherLinks,
        String profileUrl,
        Instant createdAt)
        implements ProfileProjection {}
