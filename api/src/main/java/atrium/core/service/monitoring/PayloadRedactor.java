package atrium.core.service.monitoring;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import atrium.core.config.MonitoringConfig;

/**
 * Replaces sensitive values in a JSON payload before it is logged.
 *
 * <p>A key is sensitive when its lower-cased name contains one of the sensitive names, so
 * {@code requesterEmail} and {@code accessToken} are both caught. Structure and non-sensitive
 * values are preserved. The input is never modified.
 */
@ApplicationScoped
public class PayloadRedactor {

    public static final String PLACEHOLDER = "[REDACTED]";

    static final Set<String> BUILT_IN_SENSITIVE_FIELDS =
            Set.of("password", "token", "secret", "email", "phone", "ssn", "credit_card", "creditcard", "authorization");

    private final Set<String> sensitiveFields;

    @Inject
    public PayloadRedactor(MonitoringConfig config) {
        this(config.sensitiveFields().orElse(List.of()));
    }

    public PayloadRedactor(List<String> additionalFields) {
        this.sensitiveFields = Stream.concat(BUILT_IN_SENSITIVE_FIELDS.stream(), additionalFields.stream())
                .map(f -> f.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param payload any JSON value, may be null
     * @return a redacted copy
     */
    public JsonNode redact(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        if (payload.isObject()) {
            final var copy = JsonNodeFactory.instance.objectNode();
            payload.fields().forEachRemaining(e -> copy.set(
                    e.getKey(), isSensitive(e.getKey()) ? TextNode.valueOf(PLACEHOLDER) : redact(e.getValue())));
            return copy;
        }
        if (payload.isArray()) {
            final ArrayNode copy = JsonNodeFactory.instance.arrayNode(payload.size());
            payload.forEach(item -> copy.add(redact(item)));
            return copy;
        }
        return payload.deepCopy();
    }

    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        final var normalized = key.toLowerCase(Locale.ROOT);
        return sensitiveFields.stream().anyMatch(normalized::contains);
    }
}
