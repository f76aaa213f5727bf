package atrium.core.service.security;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import atrium.core.config.SecurityValidationConfig;
import atrium.core.model.common.CorsPolicy;
import atrium.core.model.common.RequestHeaders;
import atrium.core.model.common.SecurityFinding;

/**
 * Classifies requests and payloads for risk.
 *
 * <p>Hard checks (method, URL length, declared and actual body size, content type, JSON syntax,
 * nesting depth) produce errors and an invalid finding. Heuristics (automated user agents,
 * unexpected origins, script patterns, oversized strings) produce warnings and leave the request
 * valid, unless enough script patterns appear in one payload to classify it as malicious.
 *
 * <p>All checks are CPU-only.
 */
@ApplicationScoped
public class SecurityValidator {

    private static final Logger LOG = Logger.getLogger(SecurityValidator.class);

    /**
     * Result of inspecting a raw body: the finding, and the parsed JSON when parsing succeeded.
     */
    public record BodyInspection(SecurityFinding finding, Optional<JsonNode> json, boolean malformed) {}

    private final SecurityValidationConfig config;
    private final CorsPolicy corsPolicy;
    private final ObjectMapper objectMapper;
    private final Pattern flaggedUserAgent;
    private final List<String> suspiciousPatterns;

    @Inject
    public SecurityValidator(SecurityValidationConfig config, CorsPolicy corsPolicy, ObjectMapper objectMapper) {
        this.config = config;
        this.corsPolicy = corsPolicy;
        this.objectMapper = objectMapper;
        this.flaggedUserAgent = Pattern.compile(config.flaggedUserAgentPattern(), Pattern.CASE_INSENSITIVE);
        this.suspiciousPatterns = config.suspiciousPatterns().stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }

    // -------------------------------------------------------------------------
    // Request line and headers
    // -------------------------------------------------------------------------

    /**
     * Validate the method, headers and URL of a request.
     *
     * @param method  HTTP method
     * @param headers request headers
     * @param url     full request URL
     * @return the finding
     */
    public SecurityFinding validateRequest(String method, RequestHeaders headers, String url) {
        final var errors = new ArrayList<String>();
        final var warnings = new ArrayList<String>();

        final var normalizedMethod = method == null ? "" : method.toUpperCase(Locale.ROOT);
        if (!isAllowedMethod(normalizedMethod)) {
            errors.add("Method " + normalizedMethod + " not allowed");
        }

        if (url != null && url.length() > config.maxUrlLength()) {
            errors.add("URL too long: %d > %d".formatted(url.length(), config.maxUrlLength()));
        }

        headers.first("Content-Length").flatMap(SecurityValidator::parseLong).ifPresent(length -> {
            if (length > config.maxBodySize()) {
                errors.add("Request body too large: %d > %d".formatted(length, config.maxBodySize()));
            }
        });

        if ("POST".equals(normalizedMethod)) {
            final var contentType = headers.get("Content-Type");
            if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("application/json")) {
                errors.add("Content-Type must be application/json");
            }
        }

        final var userAgent = headers.get("User-Agent");
        if (userAgent != null && flaggedUserAgent.matcher(userAgent).find()) {
            warnings.add("Automated user agent detected");
        }

        final var origin = headers.get("Origin");
        if (!corsPolicy.isOriginPermitted(origin)) {
            warnings.add("Origin not in allow-list: " + origin);
        }

        final var urlHits = countPatternHits(url, warnings, "URL");
        final var malicious = urlHits >= config.maliciousPatternThreshold();

        return SecurityFinding.of(errors, warnings, malicious);
    }

    public boolean isAllowedMethod(String method) {
        return method != null && config.allowedMethods().stream().anyMatch(m -> m.equalsIgnoreCase(method));
    }

    // -------------------------------------------------------------------------
    // Body
    // -------------------------------------------------------------------------

    /**
     * Check the actual size of a raw body, parse it, and validate the parsed content.
     *
     * @param rawBody the raw request body
     * @return the inspection result
     */
    public BodyInspection inspectBody(String rawBody) {
        final var size = rawBody.getBytes(StandardCharsets.UTF_8).length;
        if (size > config.maxBodySize()) {
            return new BodyInspection(
                    SecurityFinding.of(
                            List.of("Request body too large: %d > %d".formatted(size, config.maxBodySize())),
                            List.of(),
                            false),
                    Optional.empty(),
                    false);
        }

        final JsonNode json;
        try {
            json = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            LOG.debugv("Malformed JSON body: {0}", e.getOriginalMessage());
            return new BodyInspection(
                    SecurityFinding.of(List.of("Malformed JSON"), List.of(), false), Optional.empty(), true);
        }
        return new BodyInspection(validateBody(json), Optional.ofNullable(json), false);
    }

    /**
     * Validate parsed JSON content.
     *
     * @param parsedJson the parsed body
     * @return the finding
     */
    public SecurityFinding validateBody(JsonNode parsedJson) {
        final var errors = new ArrayList<String>();
        final var warnings = new ArrayList<String>();

        if (parsedJson == null || !parsedJson.isObject()) {
            errors.add("Request body must be a JSON object");
            return SecurityFinding.of(errors, warnings, false);
        }

        final var depth = depthOf(parsedJson, 0);
        if (depth > config.maxJsonDepth()) {
            errors.add("JSON nesting too deep: %d > %d".formatted(depth, config.maxJsonDepth()));
        }

        final var hits = new int[1];
        scanStrings(parsedJson, "$", warnings, hits);
        final var malicious = hits[0] >= config.maliciousPatternThreshold();

        return SecurityFinding.of(errors, warnings, malicious);
    }

    private void scanStrings(JsonNode node, String path, List<String> warnings, int[] hits) {
        if (node.isTextual()) {
            final var value = node.asText();
            if (value.length() > config.maxStringLength()) {
                warnings.add("Oversized string at " + path);
            }
            hits[0] += countPatternHits(value, warnings, path);
        } else if (node.isObject()) {
            node.fields().forEachRemaining(e -> scanStrings(e.getValue(), path + "." + e.getKey(), warnings, hits));
        } else if (node.isArray()) {
            for (var i = 0; i < node.size(); i++) {
                scanStrings(node.get(i), path + "[" + i + "]", warnings, hits);
            }
        }
    }

    private int countPatternHits(String value, List<String> warnings, String location) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        final var lower = value.toLowerCase(Locale.ROOT);
        var hits = 0;
        for (final var pattern : suspiciousPatterns) {
            if (lower.contains(pattern)) {
                hits++;
                warnings.add("Suspicious pattern '%s' in %s".formatted(pattern, location));
            }
        }
        return hits;
    }

    private static int depthOf(JsonNode node, int current) {
        if (!node.isContainerNode()) {
            return current;
        }
        var max = current + 1;
        for (final var child : node) {
            max = Math.max(max, depthOf(child, current + 1));
        }
        return max;
    }

    private static Optional<Long> parseLong(String value) {
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
