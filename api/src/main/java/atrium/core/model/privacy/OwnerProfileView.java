package atrium.core.model.privacy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import atrium.core.model.profile.AvailabilityOption;

/**
 * Full view of a profile, returned only to its owner through the web API.
 */
public record OwnerProfileView(
        String id,
        String slug,
        String name,
        String email,
        String bio,
        String headline,
        String location,
        List<String> skills,
        Set<AvailabilityOption> availableFor,
        String linkedinUrl,
        Map<String, String> otherLinks,
        boolean isPublic,
        boolean isActive,
        String profileUrl,
        Instant createdAt,
        Instant updatedAt)
        implements ProfileProjection {}
