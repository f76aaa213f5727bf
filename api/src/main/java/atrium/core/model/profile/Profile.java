package atrium.core.model.profile;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical internal representation of a directory profile.
 *
 * <p>This record is never serialized directly. Every outbound representation is produced by a
 * projection in {@code atrium.core.model.privacy}.
 */
public record Profile(
        String id,
        String ownerId,
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
        Instant createdAt,
        Instant updatedAt) {

    public Profile {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Profile id cannot be blank");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Profile ownerId cannot be blank");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Profile slug cannot be blank");
        }
        skills = skills != null ? List.copyOf(skills) : List.of();
        availableFor = availableFor != null ? Set.copyOf(availableFor) : Set.of();
        otherLinks = otherLinks != null ? Map.copyOf(otherLinks) : Map.of();
        createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    /** @return true when the resource is visible to callers other than the owner */
    public boolean isExternallyVisible() {
        return isPublic && isActive;
    }

    public boolean isOwnedBy(String userId) {
        return userId != null && ownerId.equals(userId);
    }

    public boolean accepts(RequestType requestType) {
        return availableFor.contains(requestType.requiredAvailability());
    }

    public Profile withVisibility(boolean newIsPublic, boolean newIsActive, Instant now) {
        return new Profile(
                id, ownerId, slug, name, email, bio, headline, location, skills, availableFor, linkedinUrl,
                otherLinks, newIsPublic, newIsActive, createdAt, now);
    }
}
