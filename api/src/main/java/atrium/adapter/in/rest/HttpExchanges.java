package atrium.adapter.in.rest;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.vertx.core.http.HttpServerRequest;

import atrium.core.model.common.InboundRequest;
import atrium.core.model.common.RequestHeaders;
import atrium.core.model.pipeline.GatewayResponse;

/**
 * Converts between JAX-RS request/response types and the pipeline's transport-neutral types.
 */
public final class HttpExchanges {

    private HttpExchanges() {}

    public static InboundRequest toInboundRequest(
            ContainerRequestContext requestContext,
            HttpServerRequest serverRequest,
            Map<String, String> pathParams,
            byte[] body) {
        final var headers = new HashMap<String, List<String>>();
        for (final var entry : requestContext.getHeaders().entrySet()) {
            headers.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        final var queryParams = new HashMap<String, List<String>>();
        for (final var entry : requestContext.getUriInfo().getQueryParameters().entrySet()) {
            queryParams.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        final var remoteAddress = serverRequest != null && serverRequest.remoteAddress() != null
                ? serverRequest.remoteAddress().host()
                : null;

        return new InboundRequest(
                requestContext.getMethod(),
                requestContext.getUriInfo().getPath(),
                requestContext.getUriInfo().getRequestUri().toString(),
                RequestHeaders.of(headers),
                queryParams,
                pathParams,
                body != null ? new String(body, StandardCharsets.UTF_8) : "",
                remoteAddress);
    }

    public static Response toResponse(GatewayResponse response) {
        final var builder = Response.status(response.status());
        response.headers().forEach(builder::header);
        if (!response.body().isEmpty()) {
            builder.entity(response.body());
        }
        return builder.build();
    }
}
