package atrium.core.service.pipeline;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import atrium.core.config.PipelineConfig;
import atrium.core.config.RateLimitingConfig;
import atrium.core.model.common.ApiError;
import atrium.core.model.common.ApiErrors;
import atrium.core.model.common.ClientIdentity;
import atrium.core.model.common.CorsPolicy;
import atrium.core.model.common.ErrorCode;
import atrium.core.model.common.InboundRequest;
import atrium.core.model.common.SecurityFinding;
import atrium.core.model.monitoring.RequestCompletion;
import atrium.core.model.monitoring.RequestHandle;
import atrium.core.model.pipeline.AgentCall;
import atrium.core.model.pipeline.EndpointPolicy;
import atrium.core.model.pipeline.GatewayResponse;
import atrium.core.model.pipeline.HandlerResult;
import atrium.core.model.privacy.AccessAction;
import atrium.core.model.privacy.PrivacyViolation;
import atrium.core.model.profile.Profile;
import atrium.core.model.ratelimit.RateLimitDecision;
import atrium.core.model.validation.FieldRule;
import atrium.core.model.validation.RequestSchema;
import atrium.core.port.out.Metrics;
import atrium.core.port.out.RateLimiter;
import atrium.core.port.out.SecurityEventPublisher;
import atrium.core.service.common.ClientIdentityExtractor;
import atrium.core.service.monitoring.PayloadRedactor;
import atrium.core.service.monitoring.RequestMonitor;
import atrium.core.service.privacy.PrivacyEngine;
import atrium.core.service.ratelimit.RateLimitTierRegistry;
import atrium.core.service.security.SchemaValidator;
import atrium.core.service.security.SecurityValidator;
import atrium.spi.SecurityEvent;

/**
 * Runs every agent-facing request through the gates in a fixed order, stopping at the first
 * failure: security validation, method check, rate limit, argument validation, the domain
 * handler, then output sanitization.
 *
 * <p>OPTIONS requests are answered right after identity extraction with CORS headers and are
 * neither rate limited nor monitored. Every other request is recorded by the
 * {@link RequestMonitor} exactly once, including when it times out or is cancelled.
 *
 * <p>Failures are returned as responses carrying the standard error envelope. Handler exceptions
 * are logged here and surfaced only as a generic internal error.
 */
@ApplicationScoped
public class AgentRequestPipeline {

    private static final Logger LOG = Logger.getLogger(AgentRequestPipeline.class);
    private static final Logger ACCESS_AUDIT = Logger.getLogger("atrium.security.access");

    static final String API_TYPE = "MCP";
    private static final String JSON = "application/json";

    /**
     * Domain logic invoked once a request has cleared every gate.
     */
    @FunctionalInterface
    public interface EndpointHandler {
        Uni<HandlerResult> handle(AgentCall call);
    }

    private final ClientIdentityExtractor identityExtractor;
    private final SecurityValidator securityValidator;
    private final SchemaValidator schemaValidator;
    private final RateLimiter rateLimiter;
    private final RateLimitTierRegistry tiers;
    private final PrivacyEngine privacyEngine;
    private final RequestMonitor monitor;
    private final PayloadRedactor redactor;
    private final SecurityEventPublisher securityEvents;
    private final Metrics metrics;
    private final CorsPolicy corsPolicy;
    private final PipelineConfig config;
    private final boolean includeRateLimitHeaders;
    private final ObjectMapper objectMapper;
    private final LongSupplier clock;

    @Inject
    public AgentRequestPipeline(
            ClientIdentityExtractor identityExtractor,
            SecurityValidator securityValidator,
            SchemaValidator schemaValidator,
            RateLimiter rateLimiter,
            RateLimitTierRegistry tiers,
            PrivacyEngine privacyEngine,
            RequestMonitor monitor,
            PayloadRedactor redactor,
            SecurityEventPublisher securityEvents,
            Metrics metrics,
            CorsPolicy corsPolicy,
            PipelineConfig config,
            RateLimitingConfig rateLimitingConfig,
            ObjectMapper objectMapper) {
        this(
                identityExtractor,
                securityValidator,
                schemaValidator,
                rateLimiter,
                tiers,
                privacyEngine,
                monitor,
                redactor,
                securityEvents,
                metrics,
                corsPolicy,
                config,
                rateLimitingConfig.includeHeaders(),
                objectMapper,
                System::currentTimeMillis);
    }

    public AgentRequestPipeline(
            ClientIdentityExtractor identityExtractor,
            SecurityValidator securityValidator,
            SchemaValidator schemaValidator,
            RateLimiter rateLimiter,
            RateLimitTierRegistry tiers,
            PrivacyEngine privacyEngine,
            RequestMonitor monitor,
            PayloadRedactor redactor,
            SecurityEventPublisher securityEvents,
            Metrics metrics,
            CorsPolicy corsPolicy,
            PipelineConfig config,
            boolean includeRateLimitHeaders,
            ObjectMapper objectMapper,
            LongSupplier clock) {
        this.identityExtractor = identityExtractor;
        this.securityValidator = securityValidator;
        this.schemaValidator = schemaValidator;
        this.rateLimiter = rateLimiter;
        this.tiers = tiers;
        this.privacyEngine = privacyEngine;
        this.monitor = monitor;
        this.redactor = redactor;
        this.securityEvents = securityEvents;
        this.metrics = metrics;
        this.corsPolicy = corsPolicy;
        this.config = config;
        this.includeRateLimitHeaders = includeRateLimitHeaders;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Process one request.
     *
     * @param request the inbound request
     * @param policy  the endpoint's policy
     * @param handler the domain handler
     * @return the finished response; never fails for errors raised inside the pipeline
     */
    public Uni<GatewayResponse> process(InboundRequest request, EndpointPolicy policy, EndpointHandler handler) {
        final var identity = identityExtractor.extract(request);

        if ("OPTIONS".equals(request.method())) {
            return Uni.createFrom().item(preflight(identity));
        }

        final var exchange = new Exchange(request, policy, identity, monitor.startRequest(policy.name(), request.method()));

        return Uni.createFrom()
                .deferred(() -> gate(exchange, handler))
                .onFailure()
                .recoverWithItem(failure -> {
                    LOG.errorv(
                            failure,
                            "Unhandled error processing {0} {1} ({2})",
                            request.method(),
                            policy.name(),
                            exchange.handle.requestId());
                    return error(exchange, ApiErrors.internal(), Map.of());
                })
                .ifNoItem()
                .after(config.timeout())
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Request {0} to {1} timed out after {2}",
                            exchange.handle.requestId(),
                            policy.name(),
                            config.timeout());
                    metrics.recordTimeout(policy.name());
                    return error(exchange, ApiErrors.timeout(), Map.of());
                })
                .onItem()
                .invoke(response -> complete(exchange, response))
                .onCancellation()
                .invoke(() -> cancelled(exchange));
    }

    // -------------------------------------------------------------------------
    // Gates
    // -------------------------------------------------------------------------

    private Uni<GatewayResponse> gate(Exchange exchange, EndpointHandler handler) {
        final var request = exchange.request;
        final var policy = exchange.policy;

        final var finding = securityValidator.validateRequest(request.method(), request.headers(), request.url());
        audit(exchange, finding);
        if (!finding.isValid()) {
            if (!securityValidator.isAllowedMethod(request.method())) {
                return Uni.createFrom().item(methodNotAllowed(exchange));
            }
            return Uni.createFrom().item(error(exchange, ApiErrors.securityRejected(finding.errors()), Map.of()));
        }

        if (!policy.allows(request.method())) {
            return Uni.createFrom().item(methodNotAllowed(exchange));
        }

        final var tier = tiers.resolve(policy.tier());
        return rateLimiter.checkLimit(exchange.identity.rateLimitKey(), tier).flatMap(decision -> {
            exchange.decision = decision;
            metrics.recordRateLimitCheck(tier.name(), decision.allowed(), decision.remaining());
            if (!decision.allowed()) {
                return Uni.createFrom().item(rateLimited(exchange, decision, tier.name(), tier.windowMs()));
            }
            return invoke(exchange, handler);
        });
    }

    private Uni<GatewayResponse> invoke(Exchange exchange, EndpointHandler handler) {
        final ObjectNode arguments;
        if ("POST".equals(exchange.request.method())) {
            final var parsed = parseBody(exchange);
            if (parsed.error().isPresent()) {
                return Uni.createFrom().item(error(exchange, parsed.error().get(), Map.of()));
            }
            arguments = parsed.arguments();
        } else {
            arguments = fromQuery(exchange.request.queryParams(), exchange.policy.schema());
        }

        if (exchange.policy.schema().isPresent()) {
            final var violations = schemaValidator.validate(exchange.policy.schema().get(), arguments);
            if (!violations.isEmpty()) {
                return Uni.createFrom()
                        .item(error(exchange, ApiErrors.validation("Invalid request parameters", violations), Map.of()));
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debugv(
                    "{0} {1} arguments: {2}",
                    exchange.handle.requestId(),
                    exchange.policy.name(),
                    redactor.redact(arguments));
        }

        final var call = new AgentCall(
                exchange.handle.requestId(),
                exchange.identity,
                arguments,
                exchange.request.pathParams(),
                exchange.policy);

        return Uni.createFrom().deferred(() -> handler.handle(call)).map(result -> render(exchange, result));
    }

    private record ParsedBody(ObjectNode arguments, Optional<ApiError> error) {

        static ParsedBody ok(ObjectNode arguments) {
            return new ParsedBody(arguments, Optional.empty());
        }

        static ParsedBody failed(ApiError error) {
            return new ParsedBody(null, Optional.of(error));
        }
    }

    private ParsedBody parseBody(Exchange exchange) {
        final var request = exchange.request;
        if (!request.hasBody()) {
            return ParsedBody.ok(objectMapper.createObjectNode());
        }

        final var inspection = securityValidator.inspectBody(request.body());
        audit(exchange, inspection.finding());
        if (inspection.malformed()) {
            return ParsedBody.failed(ApiErrors.invalidJson("Request body is not valid JSON"));
        }
        if (!inspection.finding().isValid()) {
            return ParsedBody.failed(ApiErrors.securityRejected(inspection.finding().errors()));
        }
        return ParsedBody.ok((ObjectNode) inspection.json().orElseThrow());
    }

    /**
     * Convert query parameters into the same argument shape a JSON body would have, using the
     * schema to decide which parameters are arrays, numbers or booleans. Values that do not parse
     * stay textual so the schema validator reports them.
     */
    ObjectNode fromQuery(Map<String, List<String>> queryParams, Optional<RequestSchema> schema) {
        final var node = objectMapper.createObjectNode();
        final var fields = schema.map(RequestSchema::byName).orElse(Map.of());
        queryParams.forEach((name, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            final var spec = fields.get(name);
            final var rule = spec != null ? spec.rule() : null;
            if (rule instanceof FieldRule.ArrayRule) {
                final var array = node.putArray(name);
                values.stream()
                        .flatMap(v -> List.of(v.split(",")).stream())
                        .map(String::trim)
                        .filter(v -> !v.isEmpty())
                        .forEach(array::add);
            } else {
                node.set(name, scalar(values.get(0), rule));
            }
        });
        return node;
    }

    private JsonNode scalar(String value, FieldRule rule) {
        final var factory = objectMapper.getNodeFactory();
        if (rule instanceof FieldRule.NumberRule) {
            try {
                return factory.numberNode(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                return factory.textNode(value);
            }
        }
        if (rule instanceof FieldRule.BooleanRule) {
            final var normalized = value.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized) || "false".equals(normalized)) {
                return factory.booleanNode(Boolean.parseBoolean(normalized));
            }
        }
        return factory.textNode(value);
    }

    // -------------------------------------------------------------------------
    // Results
    // -------------------------------------------------------------------------

    private GatewayResponse render(Exchange exchange, HandlerResult result) {
        final var viewerId = exchange.identity.viewerId();
        final var context = exchange.policy.outputContext();

        if (result instanceof HandlerResult.ProfileFound found) {
            final var profile = found.profile();
            final var projection = privacyEngine.sanitizeForContext(profile, viewerId, context);
            if (projection.isEmpty()) {
                final var violation = privacyEngine
                        .violationReason(profile, viewerId, AccessAction.VIEW)
                        .orElse(PrivacyViolation.PRIVATE);
                return denied(exchange, violation);
            }
            if (privacyEngine.shouldLogAccess(profile, viewerId, AccessAction.VIEW)) {
                ACCESS_AUDIT.infov(
                        "ACCESS: client={0} endpoint={1} profile={2} owner={3}",
                        exchange.identity.hashedIp(),
                        exchange.policy.name(),
                        profile.id(),
                        profile.isOwnedBy(viewerId));
            }
            return ok(exchange, 200, Map.of("profile", projection.get()));
        }
        if (result instanceof HandlerResult.ProfileList list) {
            return ok(exchange, 200, page(list, viewerId, exchange));
        }
        if (result instanceof HandlerResult.Payload payload) {
            return ok(exchange, payload.status(), payload.body());
        }
        if (result instanceof HandlerResult.Denied denied) {
            return denied(exchange, denied.violation());
        }
        if (result instanceof HandlerResult.Rejected rejected) {
            return error(exchange, rejected.error(), Map.of());
        }
        return error(exchange, ApiErrors.notFound(), Map.of());
    }

    private Map<String, Object> page(HandlerResult.ProfileList list, String viewerId, Exchange exchange) {
        final var context = exchange.policy.outputContext();
        final List<Profile> visible = privacyEngine.filterCollectionForViewer(list.candidates(), viewerId, context);
        final var total = visible.size();
        final var from = Math.min(list.offset(), total);
        final var to = Math.min(from + list.limit(), total);

        final var profiles = visible.subList(from, to).stream()
                .map(p -> privacyEngine.sanitizeForContext(p, viewerId, context))
                .flatMap(Optional::stream)
                .toList();

        final var pagination = new LinkedHashMap<String, Object>();
        pagination.put("total", total);
        pagination.put("limit", list.limit());
        pagination.put("offset", list.offset());
        pagination.put("hasMore", (long) list.offset() + list.limit() < total);

        final var body = new LinkedHashMap<String, Object>();
        body.put("profiles", profiles);
        body.put("pagination", pagination);
        return body;
    }

    private GatewayResponse denied(Exchange exchange, PrivacyViolation violation) {
        metrics.recordPrivacyDenial(exchange.policy.name(), violation.reason());
        securityEvents.publish(new SecurityEvent.PrivacyDenied(
                Instant.ofEpochMilli(clock.getAsLong()),
                exchange.identity.hashedIp(),
                exchange.policy.name(),
                violation.reason()));
        return error(exchange, privacyEngine.toPrivacySafeError(violation), Map.of());
    }

    private GatewayResponse methodNotAllowed(Exchange exchange) {
        return error(
                exchange,
                ApiErrors.methodNotAllowed(exchange.request.method(), exchange.policy.allowedMethods()),
                Map.of("Allow", exchange.policy.allowHeader()));
    }

    private GatewayResponse rateLimited(Exchange exchange, RateLimitDecision decision, String tier, long windowMs) {
        final var retryAfter = decision.retryAfterSeconds(clock.getAsLong());
        securityEvents.publish(new SecurityEvent.RateLimitExceeded(
                Instant.ofEpochMilli(clock.getAsLong()),
                exchange.identity.hashedIp(),
                exchange.policy.name(),
                tier,
                decision.totalHitsInWindow(),
                decision.limit(),
                windowMs / 1000));
        return error(
                exchange,
                ApiErrors.rateLimited(retryAfter, decision.resetTime()),
                Map.of("Retry-After", String.valueOf(retryAfter)));
    }

    private void audit(Exchange exchange, SecurityFinding finding) {
        if (finding.isSafe()) {
            return;
        }
        final var endpoint = exchange.policy.name();
        final var now = Instant.ofEpochMilli(clock.getAsLong());
        metrics.recordSecurityFinding(endpoint, finding.riskLevel(), !finding.isValid());
        if (!finding.isValid()) {
            securityEvents.publish(new SecurityEvent.RequestBlocked(
                    now,
                    exchange.identity.hashedIp(),
                    endpoint,
                    exchange.request.method(),
                    exchange.identity.userAgent(),
                    finding.errors()));
        } else {
            securityEvents.publish(new SecurityEvent.SuspiciousRequest(
                    now, exchange.identity.hashedIp(), endpoint, exchange.identity.userAgent(), finding.warnings()));
        }
    }

    // -------------------------------------------------------------------------
    // Responses
    // -------------------------------------------------------------------------

    private GatewayResponse ok(Exchange exchange, int status, Object body) {
        return new GatewayResponse(status, headers(exchange, Map.of()), serialize(body), Optional.empty());
    }

    private GatewayResponse error(Exchange exchange, ApiError error, Map<String, String> extraHeaders) {
        exchange.errorMessage = error.error();
        return new GatewayResponse(
                error.httpStatus(), headers(exchange, extraHeaders), serialize(error), Optional.of(error.code().name()));
    }

    private GatewayResponse preflight(ClientIdentity identity) {
        final var headers = new LinkedHashMap<String, String>(corsPolicy.headersFor(identity.origin().orElse(null)));
        return new GatewayResponse(200, headers, "", Optional.empty());
    }

    private Map<String, String> headers(Exchange exchange, Map<String, String> extra) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", JSON);
        headers.put("X-Request-ID", exchange.handle.requestId());
        headers.put("X-API-Version", config.apiVersion());
        headers.put("X-API-Type", API_TYPE);

        final var decision = exchange.decision;
        if (includeRateLimitHeaders && decision != null && !decision.isUnlimited()) {
            headers.put("X-RateLimit-Limit", String.valueOf(decision.limit()));
            headers.put("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
            headers.put("X-RateLimit-Reset", String.valueOf(decision.resetEpochSeconds()));
        }

        headers.putAll(corsPolicy.headersFor(exchange.identity.origin().orElse(null)));

        headers.put("X-Content-Type-Options", "nosniff");
        headers.put("X-Frame-Options", "DENY");
        headers.put("X-XSS-Protection", "1; mode=block");
        headers.put("Referrer-Policy", "strict-origin-when-cross-origin");
        headers.put("Content-Security-Policy", config.contentSecurityPolicy());
        headers.put("Cache-Control", "no-store");

        headers.putAll(extra);
        return headers;
    }

    private String serialize(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }

    // -------------------------------------------------------------------------
    // Monitoring
    // -------------------------------------------------------------------------

    private void complete(Exchange exchange, GatewayResponse response) {
        if (!exchange.recorded.compareAndSet(false, true)) {
            return;
        }
        monitor.endRequest(
                exchange.handle,
                new RequestCompletion(
                        response.status(),
                        exchange.identity.ip(),
                        exchange.identity.userAgent(),
                        exchange.request.bodySizeBytes(),
                        response.bodySizeBytes(),
                        response.errorCode().orElse(null),
                        response.isSuccess() ? null : exchange.errorMessage));
    }

    private void cancelled(Exchange exchange) {
        if (!exchange.recorded.compareAndSet(false, true)) {
            return;
        }
        LOG.debugv("Request {0} cancelled by the client", exchange.handle.requestId());
        monitor.endRequest(
                exchange.handle,
                new RequestCompletion(
                        ErrorCode.CLIENT_CLOSED_REQUEST.httpStatus(),
                        exchange.identity.ip(),
                        exchange.identity.userAgent(),
                        exchange.request.bodySizeBytes(),
                        0,
                        ErrorCode.CLIENT_CLOSED_REQUEST.name(),
                        "Request cancelled"));
    }

    /**
     * Per-request state shared between the gates and the terminal callbacks.
     */
    private static final class Exchange {

        private final InboundRequest request;
        private final EndpointPolicy policy;
        private final ClientIdentity identity;
        private final RequestHandle handle;
        private final AtomicBoolean recorded = new AtomicBoolean();
        private volatile RateLimitDecision decision;
        private volatile String errorMessage;

        private Exchange(InboundRequest request, EndpointPolicy policy, ClientIdentity identity, RequestHandle handle) {
            this.request = request;
            this.policy = policy;
            this.identity = identity;
            this.handle = handle;
        }
    }
}
