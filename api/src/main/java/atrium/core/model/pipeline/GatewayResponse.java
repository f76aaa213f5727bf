package atrium.core.model.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Finished response produced by the pipeline: status, headers and the serialized JSON body.
 *
 * @param status  HTTP status
 * @param headers response headers in insertion order
 * @param body    JSON body, empty for bodiless responses
 * @param errorCode the error code when the response is a failure, used by monitoring
 */
public record GatewayResponse(int status, Map<String, String> headers, String body, Optional<String> errorCode) {

    public GatewayResponse {
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        body = body != null ? body : "";
        errorCode = errorCode != null ? errorCode : Optional.empty();
    }

    public String header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    public long bodySizeBytes() {
        return body.getBytes(StandardCharsets.UTF_8).length;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 400;
    }
}
