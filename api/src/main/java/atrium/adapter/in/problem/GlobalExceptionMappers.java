package atrium.adapter.in.problem;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.NotAllowedException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import atrium.core.model.common.ApiError;
import atrium.core.model.common.ApiErrors;
import atrium.core.model.common.ErrorCode;

/**
 * Global exception mappers converting exceptions raised outside the request pipeline (unknown
 * routes, unmapped methods, framework failures) into the standard error envelope.
 *
 * <p>Messages are fixed; exception text never reaches the response body.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapNotFound(NotFoundException e) {
        return toResponse(ApiErrors.notFound());
    }

    @ServerExceptionMapper
    public Response mapNotAllowed(NotAllowedException e) {
        final var allowed = e.getResponse().getAllowedMethods();
        final var error = ApiErrors.of(
                "Method not allowed", ErrorCode.METHOD_NOT_ALLOWED, Map.of("allowedMethods", List.copyOf(allowed)));
        final var builder = Response.status(error.httpStatus()).type(MediaType.APPLICATION_JSON).entity(error);
        if (!allowed.isEmpty()) {
            builder.header("Allow", String.join(", ", allowed));
        }
        return builder.build();
    }

    @ServerExceptionMapper
    public Response mapWebApplicationException(WebApplicationException e) {
        final var status = e.getResponse().getStatus();
        if (status >= 500) {
            LOG.errorv(e, "Request failed with status {0}", status);
            return toResponse(ApiErrors.internal());
        }
        LOG.debugv("Request rejected with status {0}: {1}", status, e.getMessage());
        return toResponse(switch (status) {
            case 401 -> ApiErrors.unauthenticated();
            case 403 -> ApiErrors.forbidden();
            case 404 -> ApiErrors.notFound();
            default -> ApiErrors.validation("Invalid request");
        });
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ApiErrors.validation("Invalid request"));
    }

    @ServerExceptionMapper
    public Response mapUnexpected(Exception e) {
        LOG.errorv(e, "Unexpected error: {0}", e.getMessage());
        return toResponse(ApiErrors.internal());
    }

    private static Response toResponse(ApiError error) {
        return Response.status(error.httpStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }
}
