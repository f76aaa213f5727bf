package atrium.core.model.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import atrium.core.model.privacy.OutputContext;
import atrium.core.model.validation.RequestSchema;

/**
 * Static description of a protected endpoint: which methods it accepts, which rate-limit tier it
 * draws from, the schema its arguments must satisfy, and the context its output is sanitized for.
 */
public record EndpointPolicy(
        String name, List<String> allowedMethods, String tier, Optional<RequestSchema> schema, OutputContext outputContext) {

    public EndpointPolicy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Endpoint name cannot be blank");
        }
        if (allowedMethods == null || allowedMethods.isEmpty()) {
            throw new IllegalArgumentException("Endpoint must allow at least one method");
        }
        allowedMethods = allowedMethods.stream()
                .map(m -> m.toUpperCase(Locale.ROOT))
                .toList();
        if (tier == null || tier.isBlank()) {
            throw new IllegalArgumentException("Endpoint tier cannot be blank");
        }
        schema = schema != null ? schema : Optional.empty();
        if (outputContext == null) {
            throw new IllegalArgumentException("outputContext cannot be null");
        }
    }

    public boolean allows(String method) {
        return method != null && allowedMethods.contains(method.toUpperCase(Locale.ROOT));
    }

    /** @return the {@code Allow} header value, always including OPTIONS */
    public String allowHeader() {
        final var methods = new java.util.ArrayList<>(allowedMethods);
        if (!methods.contains("OPTIONS")) {
            methods.add("OPTIONS");
        }
        return String.join(", ", methods);
    }
}
