package atrium.core.model.privacy;

/**
 * Outbound representation of a profile for a specific {@link OutputContext}.
 */
public sealed interface ProfileProjection
        permits OwnerProfileView, PublicProfileView, AgentProfileView {

    String slug();

    String profileUrl();
}
