package atrium.core.model.common;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Transport-neutral view of an inbound HTTP request.
 *
 * @param method        HTTP method, upper case
 * @param path          request path without query string
 * @param url           full request URL including query string
 * @param headers       request headers
 * @param queryParams   decoded query parameters
 * @param pathParams    path template parameters, e.g. a profile id
 * @param body          raw request body, empty string when absent
 * @param remoteAddress socket peer address, may be null
 */
public record InboundRequest(
        String method,
        String path,
        String url,
        RequestHeaders headers,
        Map<String, List<String>> queryParams,
        Map<String, String> pathParams,
        String body,
        String remoteAddress) {

    public InboundRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be blank");
        }
        method = method.toUpperCase(java.util.Locale.ROOT);
        path = path != null ? path : "/";
        url = url != null ? url : path;
        headers = headers != null ? headers : RequestHeaders.empty();
        queryParams = queryParams != null ? Map.copyOf(queryParams) : Map.of();
        pathParams = pathParams != null ? Map.copyOf(pathParams) : Map.of();
        body = body != null ? body : "";
    }

    public boolean hasBody() {
        return !body.isBlank();
    }

    public int bodySizeBytes() {
        return body.getBytes(StandardCharsets.UTF_8).length;
    }
}
