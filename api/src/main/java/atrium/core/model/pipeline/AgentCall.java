package atrium.core.model.pipeline;

import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;

import atrium.core.model.common.ClientIdentity;

/**
 * A request that has cleared every gate and is handed to the domain handler.
 *
 * @param requestId the id reported in {@code X-Request-ID}
 * @param caller    the caller identity
 * @param arguments validated arguments (body or query parameters)
 * @param pathParams path template parameters
 * @param policy    the endpoint policy the request was checked against
 */
public record AgentCall(
        String requestId,
        ClientIdentity caller,
        ObjectNode arguments,
        Map<String, String> pathParams,
        EndpointPolicy policy) {

    public AgentCall {
        pathParams = pathParams != null ? Map.copyOf(pathParams) : Map.of();
    }

    public String viewerId() {
        return caller.viewerId();
    }

    public String text(String field) {
        final var node = arguments.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    public String pathParam(String name) {
        return pathParams.get(name);
    }

    /**
     * Read an integer argument.
     *
     * @throws IllegalArgumentException if the field is present but not an integer in {@code int} range
     */
    public int integer(String field, int defaultValue) {
        final var node = arguments.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer between "
                    + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE);
        }
        return node.intValue();
    }
}
