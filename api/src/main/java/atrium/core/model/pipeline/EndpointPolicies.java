package atrium.core.model.pipeline;

import java.util.List;
import java.util.Optional;

import atrium.core.model.privacy.OutputContext;
import atrium.core.model.validation.ToolSchemas;

/**
 * Policies for the protected endpoints.
 */
public final class EndpointPolicies {

    public static final EndpointPolicy SEARCH_PROFILES = new EndpointPolicy(
            "search_profiles",
            List.of("GET", "POST"),
            "search",
            Optional.of(ToolSchemas.SEARCH_PROFILES),
            OutputContext.AGENT_PROTOCOL);

    public static final EndpointPolicy GET_PROFILE = new EndpointPolicy(
            "get_profile",
            List.of("GET", "POST"),
            "get-profile",
            Optional.of(ToolSchemas.GET_PROFILE),
            OutputContext.AGENT_PROTOCOL);

    public static final EndpointPolicy REQUEST_MEETING = new EndpointPolicy(
            "request_meeting",
            List.of("POST"),
            "request-meeting",
            Optional.of(ToolSchemas.REQUEST_MEETING),
            OutputContext.AGENT_PROTOCOL);

    public static final EndpointPolicy HEALTH =
            new EndpointPolicy("health", List.of("GET"), "search", Optional.empty(), OutputContext.AGENT_PROTOCOL);

    public static final EndpointPolicy PROFILE_BY_ID = new EndpointPolicy(
            "get_profile_by_id", List.of("GET"), "default", Optional.empty(), OutputContext.OWNER_API);

    public static final EndpointPolicy UPDATE_PRIVACY = new EndpointPolicy(
            "update_privacy",
            List.of("POST"),
            "mutate",
            Optional.of(ToolSchemas.UPDATE_PRIVACY),
            OutputContext.OWNER_API);

    public static final EndpointPolicy ADMIN_PERFORMANCE = new EndpointPolicy(
            "admin_performance", List.of("GET"), "default", Optional.empty(), OutputContext.OWNER_API);

    private EndpointPolicies() {}
}
