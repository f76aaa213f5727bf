package atrium.adapter.in.mcp;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import atrium.adapter.in.rest.HttpExchanges;
import atrium.core.model.pipeline.EndpointPolicies;
import atrium.core.model.pipeline.EndpointPolicy;
import atrium.core.port.in.ProfileDirectory;
import atrium.core.service.monitoring.HealthReportService;
import atrium.core.service.pipeline.AgentRequestPipeline;
import atrium.core.service.pipeline.AgentRequestPipeline.EndpointHandler;

/**
 * Agent protocol (MCP) tool endpoints.
 *
 * <p>Every route runs through the {@link AgentRequestPipeline}. Routes that reject a method, such
 * as {@code GET /request-meeting}, are still mapped so the rejection carries the pipeline's
 * headers and is monitored.
 */
@Path("/api/mcp")
@ApplicationScoped
public class McpResource {

    private final AgentRequestPipeline pipeline;
    private final ProfileDirectory directory;
    private final HealthReportService healthReports;

    @Inject
    public McpResource(AgentRequestPipeline pipeline, ProfileDirectory directory, HealthReportService healthReports) {
        this.pipeline = pipeline;
        this.directory = directory;
        this.healthReports = healthReports;
    }

    // search_profiles

    @GET
    @Path("/search-profiles")
    public Uni<Response> searchProfiles(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.SEARCH_PROFILES, directory::searchProfiles);
    }

    @POST
    @Path("/search-profiles")
    public Uni<Response> searchProfilesPost(
            @Context ContainerRequestContext ctx, @Context HttpServerRequest request, byte[] body) {
        return run(ctx, request, body, EndpointPolicies.SEARCH_PROFILES, directory::searchProfiles);
    }

    @OPTIONS
    @Path("/search-profiles")
    public Uni<Response> searchProfilesOptions(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.SEARCH_PROFILES, directory::searchProfiles);
    }

    // get_profile

    @GET
    @Path("/get-profile")
    public Uni<Response> getProfile(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.GET_PROFILE, directory::getProfile);
    }

    @POST
    @Path("/get-profile")
    public Uni<Response> getProfilePost(
            @Context ContainerRequestContext ctx, @Context HttpServerRequest request, byte[] body) {
        return run(ctx, request, body, EndpointPolicies.GET_PROFILE, directory::getProfile);
    }

    @OPTIONS
    @Path("/get-profile")
    public Uni<Response> getProfileOptions(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.GET_PROFILE, directory::getProfile);
    }

    // request_meeting

    @POST
    @Path("/request-meeting")
    public Uni<Response> requestMeeting(
            @Context ContainerRequestContext ctx, @Context HttpServerRequest request, byte[] body) {
        return run(ctx, request, body, EndpointPolicies.REQUEST_MEETING, directory::requestMeeting);
    }

    @GET
    @Path("/request-meeting")
    public Uni<Response> requestMeetingGet(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.REQUEST_MEETING, directory::requestMeeting);
    }

    @OPTIONS
    @Path("/request-meeting")
    public Uni<Response> requestMeetingOptions(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.REQUEST_MEETING, directory::requestMeeting);
    }

    // health

    @GET
    @Path("/health")
    public Uni<Response> health(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, null, EndpointPolicies.HEALTH, healthReports::health);
    }

    private Uni<Response> run(
            ContainerRequestContext ctx,
            HttpServerRequest request,
            byte[] body,
            EndpointPolicy policy,
            EndpointHandler handler) {
        final var inbound = HttpExchanges.toInboundRequest(ctx, request, Map.of(), body);
        return pipeline.process(inbound, policy, handler).map(HttpExchanges::toResponse);
    }
}
