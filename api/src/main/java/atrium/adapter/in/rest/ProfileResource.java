package atrium.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import atrium.core.model.pipeline.EndpointPolicies;
import atrium.core.port.in.ProfileDirectory;
import atrium.core.service.pipeline.AgentRequestPipeline;

/**
 * Web API for individual profiles. Responses are shaped for the owner API context: owners see
 * their full profile, everyone else the public view.
 */
@Path("/api/profiles")
@ApplicationScoped
public class ProfileResource {

    private final AgentRequestPipeline pipeline;
    private final ProfileDirectory directory;

    @Inject
    public ProfileResource(AgentRequestPipeline pipeline, ProfileDirectory directory) {
        this.pipeline = pipeline;
        this.directory = directory;
    }

    @GET
    @Path("/{id}")
    public Uni<Response> getProfile(
            @PathParam("id") String id, @Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        final var inbound = HttpExchanges.toInboundRequest(ctx, request, Map.of("id", id), null);
        return pipeline.process(inbound, EndpointPolicies.PROFILE_BY_ID, directory::getProfileById)
                .map(HttpExchanges::toResponse);
    }

    @POST
    @Path("/{id}/privacy")
    public Uni<Response> updatePrivacy(
            @PathParam("id") String id,
            @Context ContainerRequestContext ctx,
            @Context HttpServerRequest request,
            byte[] body) {
        final var inbound = HttpExchanges.toInboundRequest(ctx, request, Map.of("id", id), body);
        return pipeline.process(inbound, EndpointPolicies.UPDATE_PRIVACY, directory::updatePrivacy)
                .map(HttpExchanges::toResponse);
    }

    @OPTIONS
    @Path("/{id}/privacy")
    public Uni<Response> updatePrivacyOptions(
            @PathParam("id") String id, @Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        final var inbound = HttpExchanges.toInboundRequest(ctx, request, Map.of("id", id), null);
        return pipeline.process(inbound, EndpointPolicies.UPDATE_PRIVACY, directory::updatePrivacy)
                .map(HttpExchanges::toResponse);
    }
}
