package atrium.core.service.privacy;

import atrium.core.model.privacy.AgentProfileView;
import atrium.core.model.privacy.OwnerProfileView;
import atrium.core.model.privacy.PublicProfileView;
import atrium.core.model.profile.Profile;

/**
 * Projection functions from the canonical profile to each outbound view.
 *
 * <p>Each function copies an explicit field list. Adding a field to {@link Profile} exposes it
 * nowhere until a projection names it.
 */
public final class ProfileProjections {

    private ProfileProjections() {}

    public static OwnerProfileView ownerProjection(Profile p) {
        return new OwnerProfileView(
                p.id(),
                p.slug(),
                p.name(),
                p.email(),
                p.bio(),
                p.headline(),
                p.location(),
                p.skills(),
                p.availableFor(),
                p.linkedinUrl(),
                p.otherLinks(),
                p.isPublic(),
                p.isActive(),
                profileUrl(p),
                p.createdAt(),
                p.updatedAt());
    }

    public static PublicProfileView publicProjection(Profile p) {
        return new PublicProfileView(
                p.id(),
                p.slug(),
                p.name(),
                p.bio(),
                p.headline(),
                p.location(),
                p.skills(),
                p.availableFor(),
                p.linkedinUrl(),
                p.otherLinks(),
                profileUrl(p),
                p.createdAt());
    }

    public static AgentProfileView agentProjection(Profile p) {
        return new AgentProfileView(
                p.slug(),
                p.name(),
                p.bio(),
                p.headline(),
                p.skills(),
                p.availableFor(),
                p.linkedinUrl(),
                p.otherLinks(),
                profileUrl(p));
    }

    static String profileUrl(Profile p) {
        return "/" + p.slug();
    }
}
