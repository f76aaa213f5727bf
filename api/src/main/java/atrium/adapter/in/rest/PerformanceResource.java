package atrium.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import atrium.core.model.pipeline.EndpointPolicies;
import atrium.core.service.monitoring.HealthReportService;
import atrium.core.service.pipeline.AgentRequestPipeline;
import atrium.core.service.pipeline.AgentRequestPipeline.EndpointHandler;

/**
 * Operator reports on request performance. Requires an authenticated caller.
 */
@Path("/api/admin/performance")
@ApplicationScoped
public class PerformanceResource {

    private final AgentRequestPipeline pipeline;
    private final HealthReportService reports;

    @Inject
    public PerformanceResource(AgentRequestPipeline pipeline, HealthReportService reports) {
        this.pipeline = pipeline;
        this.reports = reports;
    }

    @GET
    public Uni<Response> summary(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, reports::performance);
    }

    @GET
    @Path("/hourly")
    public Uni<Response> hourly(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, reports::hourly);
    }

    @GET
    @Path("/daily")
    public Uni<Response> daily(@Context ContainerRequestContext ctx, @Context HttpServerRequest request) {
        return run(ctx, request, reports::daily);
    }

    private Uni<Response> run(ContainerRequestContext ctx, HttpServerRequest request, EndpointHandler handler) {
        final var inbound = HttpExchanges.toInboundRequest(ctx, request, Map.of(), null);
        return pipeline.process(inbound, EndpointPolicies.ADMIN_PERFORMANCE, handler).map(HttpExchanges::toResponse);
    }
}
