package atrium.core.port.in;

import io.smallrye.mutiny.Uni;

import atrium.core.model.pipeline.AgentCall;
import atrium.core.model.pipeline.HandlerResult;

/**
 * Use cases behind the directory endpoints. Each method is a domain handler that runs after the
 * request has cleared the pipeline gates.
 */
public interface ProfileDirectory {

    /**
     * Search public profiles. Arguments follow the {@code search_profiles} schema.
     */
    Uni<HandlerResult> searchProfiles(AgentCall call);

    /**
     * Fetch one profile by slug.
     */
    Uni<HandlerResult> getProfile(AgentCall call);

    /**
     * File a meeting, quote or appointment request against a profile.
     */
    Uni<HandlerResult> requestMeeting(AgentCall call);

    /**
     * Fetch one profile by id for the web API.
     */
    Uni<HandlerResult> getProfileById(AgentCall call);

    /**
     * Change a profile's public/active flags. Owner only.
     */
    Uni<HandlerResult> updatePrivacy(AgentCall call);
}
