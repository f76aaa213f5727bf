package atrium.core.model.privacy;

import java.util.List;
import java.util.Map;
import java.util.Set;

import atrium.core.model.profile.AvailabilityOption;

/**
 * View of a profile for agents and search results. Carries neither the contact address nor any
 * internal identifier; the slug is the only handle.
 */
public record AgentProfileView(
        String slug,
        String name,
        String bio,
        String headline,
        List<String> skills,
        Set<AvailabilityOption> availableFor,
        String linkedinUrl,
        Map<String, String> otherLinks,
        String profileUrl)
        implements ProfileProjection {}
