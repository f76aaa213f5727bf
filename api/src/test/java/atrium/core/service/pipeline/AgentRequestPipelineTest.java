package atrium.core.service.pipeline;

import static atrium.support.Profiles.profile;
import static atrium.support.Profiles.publicProfile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import atrium.adapter.out.identity.HeaderIdentityProvider;
import atrium.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import atrium.core.model.common.CorsPolicy;
import atrium.core.model.common.InboundRequest;
import atrium.core.model.common.RiskLevel;
import atrium.core.model.common.RequestHeaders;
import atrium.core.model.pipeline.AgentCall;
import atrium.core.model.pipeline.EndpointPolicies;
import atrium.core.model.pipeline.EndpointPolicy;
import atrium.core.model.pipeline.GatewayResponse;
import atrium.core.model.pipeline.HandlerResult;
import atrium.core.model.ratelimit.RateLimitTier;
import atrium.core.model.validation.ToolSchemas;
import atrium.core.port.out.Metrics;
import atrium.core.port.out.SecurityEventPublisher;
import atrium.core.service.common.ClientIdentityExtractor;
import atrium.core.service.monitoring.PayloadRedactor;
import atrium.core.service.monitoring.RequestMonitor;
import atrium.core.service.privacy.PrivacyEngine;
import atrium.core.service.ratelimit.RateLimitTierRegistry;
import atrium.core.service.security.SchemaValidator;
import atrium.core.service.security.SecurityValidator;
import atrium.spi.SecurityEvent;
import atrium.support.TestConfigs.TestMonitoringConfig;
import atrium.support.TestConfigs.TestPipelineConfig;
import atrium.support.TestConfigs.TestSecurityConfig;

@DisplayName("AgentRequestPipeline")
class AgentRequestPipelineTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final String MEETING_BODY = "{\"profileSlug\":\"ada-lovelace\",\"requesterName\":\"Bob\","
            + "\"requesterEmail\":\"bob@example.com\",\"message\":\"Would love to talk about engines\","
            + "\"requestType\":\"meeting\"}";

    private AtomicLong clock;
    private ObjectMapper objectMapper;
    private Metrics metrics;
    private SecurityEventPublisher publisher;
    private RequestMonitor monitor;
    private AgentRequestPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(NOW);
        objectMapper = new ObjectMapper().findAndRegisterModules();
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        metrics = mock(Metrics.class);
        publisher = mock(SecurityEventPublisher.class);
        monitor = new RequestMonitor(TestMonitoringConfig.defaults(), metrics);
        pipeline = pipeline(TestSecurityConfig.defaults(), Duration.ofSeconds(5));
    }

    private AgentRequestPipeline pipeline(TestSecurityConfig securityConfig, Duration timeout) {
        var tiers = new RateLimitTierRegistry(Map.of(
                "search", RateLimitTier.of("search", 30, Duration.ofSeconds(60)),
                "request-meeting", RateLimitTier.of("request-meeting", 5, Duration.ofSeconds(60)),
                "default", RateLimitTier.of("default", 100, Duration.ofSeconds(60))));
        var corsPolicy = CorsPolicy.openToAll();
        return new AgentRequestPipeline(
                new ClientIdentityExtractor(new HeaderIdentityProvider()),
                new SecurityValidator(securityConfig, corsPolicy, objectMapper),
                new SchemaValidator(),
                new InMemoryRateLimiter(true, 4, clock::get),
                tiers,
                new PrivacyEngine(),
                monitor,
                new PayloadRedactor(List.of()),
                publisher,
                metrics,
                corsPolicy,
                TestPipelineConfig.withTimeout(timeout),
                true,
                objectMapper,
                clock::get);
    }

    private static InboundRequest get(String path, Map<String, List<String>> query) {
        return new InboundRequest(
                "GET",
                path,
                null,
                RequestHeaders.single(Map.of("User-Agent", "agent-test")),
                query,
                null,
                null,
                "1.2.3.4");
    }

    private static InboundRequest post(String path, String body) {
        return post(path, body, Map.of());
    }

    private static InboundRequest post(String path, String body, Map<String, String> extraHeaders) {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", "agent-test");
        headers.putAll(extraHeaders);
        return new InboundRequest(
                "POST", path, null, RequestHeaders.single(headers), null, null, body, "1.2.3.4");
    }

    private static InboundRequest request(String method) {
        return new InboundRequest(method, "/api/mcp/search-profiles", null, null, null, null, null, "1.2.3.4");
    }

    private GatewayResponse run(InboundRequest request, EndpointPolicy policy, AgentRequestPipeline.EndpointHandler handler) {
        return pipeline.process(request, policy, handler).await().atMost(Duration.ofSeconds(2));
    }

    private JsonNode body(GatewayResponse response) throws Exception {
        return objectMapper.readTree(response.body());
    }

    private static AgentRequestPipeline.EndpointHandler counting(AtomicInteger calls, HandlerResult result) {
        return call -> {
            calls.incrementAndGet();
            return Uni.createFrom().item(result);
        };
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimitTests {

        @Test
        @DisplayName("should reject the sixth meeting request in a window with 429 and Retry-After")
        void sixthRequestRejected() throws Exception {
            var calls = new AtomicInteger();
            var handler = counting(calls, HandlerResult.created(Map.of("success", true)));

            for (var i = 0; i < 5; i++) {
                var response = run(post("/api/mcp/request-meeting", MEETING_BODY), EndpointPolicies.REQUEST_MEETING, handler);
                assertEquals(201, response.status());
                assertEquals(String.valueOf(4 - i), response.header("X-RateLimit-Remaining"));
            }

            var rejected = run(post("/api/mcp/request-meeting", MEETING_BODY), EndpointPolicies.REQUEST_MEETING, handler);

            assertEquals(429, rejected.status());
            assertTrue(Long.parseLong(rejected.header("Retry-After")) > 0);
            assertEquals("RATE_LIMIT_EXCEEDED", body(rejected).get("code").asText());
            assertEquals(5, calls.get());
            verify(publisher).publish(argThat(event -> event instanceof SecurityEvent.RateLimitExceeded));
            verify(metrics).recordRateLimitCheck("request-meeting", false, 0);
        }

        @Test
        @DisplayName("should admit again after the window resets")
        void windowReset() {
            var calls = new AtomicInteger();
            var handler = counting(calls, HandlerResult.created(Map.of("success", true)));
            for (var i = 0; i < 6; i++) {
                run(post("/api/mcp/request-meeting", MEETING_BODY), EndpointPolicies.REQUEST_MEETING, handler);
            }

            clock.addAndGet(Duration.ofSeconds(61).toMillis());

            assertEquals(
                    201,
                    run(post("/api/mcp/request-meeting", MEETING_BODY), EndpointPolicies.REQUEST_MEETING, handler)
                            .status());
        }
    }

    @Nested
    @DisplayName("Security gate")
    class SecurityTests {

        @Test
        @DisplayName("should reject an oversized body before the handler runs")
        void oversizedBody() throws Exception {
            pipeline = pipeline(TestSecurityConfig.defaults().withMaxBodySize(1024), Duration.ofSeconds(5));
            var calls = new AtomicInteger();
            var body = "{\"query\":\"" + "x".repeat(2048) + "\"}";

            var response = run(
                    post("/api/mcp/search-profiles", body),
                    EndpointPolicies.SEARCH_PROFILES,
                    counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(400, response.status());
            assertEquals("SECURITY_VALIDATION_FAILED", body(response).get("code").asText());
            assertEquals(0, calls.get());
            verify(publisher).publish(argThat(event -> event instanceof SecurityEvent.RequestBlocked));
        }

        @Test
        @DisplayName("should reject an oversized declared Content-Length")
        void oversizedDeclaredLength() {
            pipeline = pipeline(TestSecurityConfig.defaults().withMaxBodySize(1024), Duration.ofSeconds(5));
            var calls = new AtomicInteger();

            var response = run(
                    post("/api/mcp/search-profiles", "{}", Map.of("Content-Length", "4096")),
                    EndpointPolicies.SEARCH_PROFILES,
                    counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(400, response.status());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("should return INVALID_JSON for a malformed body and audit it as blocked")
        void malformedJson() throws Exception {
            var calls = new AtomicInteger();

            var response = run(
                    post("/api/mcp/search-profiles", "{\"query\":"),
                    EndpointPolicies.SEARCH_PROFILES,
                    counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(400, response.status());
            assertEquals("INVALID_JSON", body(response).get("code").asText());
            assertEquals(0, calls.get());
            verify(publisher).publish(argThat(event -> event instanceof SecurityEvent.RequestBlocked blocked
                    && blocked.reasons().contains("Malformed JSON")));
            verify(metrics).recordSecurityFinding("search_profiles", RiskLevel.MALICIOUS, true);
        }

        @Test
        @DisplayName("should let an automated user agent through and report it as suspicious")
        void flaggedUserAgentIsNotBlocked() {
            var calls = new AtomicInteger();

            var response = run(
                    post("/api/mcp/search-profiles", "{\"query\":\"engines\"}", Map.of("User-Agent", "research-crawler/1.0")),
                    EndpointPolicies.SEARCH_PROFILES,
                    counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(200, response.status());
            assertEquals(1, calls.get());
            verify(publisher).publish(argThat(event -> event instanceof SecurityEvent.SuspiciousRequest suspicious
                    && suspicious.warnings().contains("Automated user agent detected")));
            verify(publisher, never()).publish(argThat(event -> event instanceof SecurityEvent.RequestBlocked));
            verify(metrics).recordSecurityFinding("search_profiles", RiskLevel.SUSPICIOUS, false);
        }

        @Test
        @DisplayName("should let a single script pattern in the body through and report it as suspicious")
        void singlePatternIsNotBlocked() {
            var calls = new AtomicInteger();

            var response = run(
                    post("/api/mcp/search-profiles", "{\"query\":\"javascript: the good parts\"}"),
                    EndpointPolicies.SEARCH_PROFILES,
                    counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(200, response.status());
            assertEquals(1, calls.get());
            verify(publisher).publish(argThat(event -> event instanceof SecurityEvent.SuspiciousRequest suspicious
                    && suspicious.warnings().stream().anyMatch(w -> w.contains("javascript:"))));
            verify(publisher, never()).publish(argThat(event -> event instanceof SecurityEvent.RequestBlocked));
        }

        @Test
        @DisplayName("should answer 405 with Allow for a method the endpoint does not take")
        void endpointMethodNotAllowed() {
            var response = run(
                    get("/api/mcp/request-meeting", Map.of()),
                    EndpointPolicies.REQUEST_MEETING,
                    call -> Uni.createFrom().item(HandlerResult.ok(Map.of())));

            assertEquals(405, response.status());
            assertEquals("POST, OPTIONS", response.header("Allow"));
        }

        @Test
        @DisplayName("should answer 405 for a method outside the global allowed set")
        void globalMethodNotAllowed() {
            var response = run(
                    request("DELETE"),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().item(HandlerResult.ok(Map.of())));

            assertEquals(405, response.status());
            assertEquals("GET, POST, OPTIONS", response.header("Allow"));
        }
    }

    @Nested
    @DisplayName("Argument validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject badly typed query parameters with field violations")
        void badQuery() throws Exception {
            var calls = new AtomicInteger();

            var response = run(
                    get("/api/mcp/search-profiles", Map.of("limit", List.of("abc"))),
                    EndpointPolicies.SEARCH_PROFILES,
                    counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(400, response.status());
            var json = body(response);
            assertEquals("VALIDATION_ERROR", json.get("code").asText());
            assertEquals("limit", json.at("/details/violations/0/field").asText());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("should reject offsets whose page end would not fit in an int")
        void offsetUpperBound() throws Exception {
            var calls = new AtomicInteger();
            var handler = counting(calls, HandlerResult.ok(Map.of()));

            for (var offset : List.of("2147483647", "3000000000", String.valueOf(ToolSchemas.MAX_OFFSET + 1L))) {
                var response = run(
                        post("/api/mcp/search-profiles", "{\"offset\":" + offset + "}"),
                        EndpointPolicies.SEARCH_PROFILES,
                        handler);

                assertEquals(400, response.status(), offset);
                var json = body(response);
                assertEquals("VALIDATION_ERROR", json.get("code").asText());
                assertEquals("offset", json.at("/details/violations/0/field").asText());
            }
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("should accept the largest allowed offset")
        void largestOffset() {
            var received = new AtomicReference<AgentCall>();

            var response = run(
                    post("/api/mcp/search-profiles", "{\"offset\":" + ToolSchemas.MAX_OFFSET + "}"),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> {
                        received.set(call);
                        return Uni.createFrom().item(HandlerResult.ok(Map.of()));
                    });

            assertEquals(200, response.status());
            assertEquals(ToolSchemas.MAX_OFFSET, received.get().integer("offset", 0));
        }

        @Test
        @DisplayName("should convert query parameters to typed arguments")
        void typedQuery() {
            var received = new AtomicReference<AgentCall>();

            var response = run(
                    get("/api/mcp/search-profiles", Map.of("limit", List.of("5"), "skills", List.of("java, kotlin"))),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> {
                        received.set(call);
                        return Uni.createFrom().item(HandlerResult.ok(Map.of()));
                    });

            assertEquals(200, response.status());
            assertEquals(5, received.get().arguments().get("limit").asInt());
            assertTrue(received.get().arguments().get("limit").isNumber());
            assertEquals(2, received.get().arguments().get("skills").size());
        }

        @Test
        @DisplayName("should treat an empty POST body as no arguments")
        void emptyBody() {
            var response = run(
                    post("/api/mcp/search-profiles", ""),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().item(HandlerResult.ok(Map.of("arguments", call.arguments().size()))));

            assertEquals(200, response.status());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should time out slow handlers with 504 and record the timeout")
        void timeout() throws Exception {
            pipeline = pipeline(TestSecurityConfig.defaults(), Duration.ofMillis(100));

            var response = run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().nothing());

            assertEquals(504, response.status());
            assertEquals("REQUEST_TIMEOUT", body(response).get("code").asText());
            verify(metrics).recordTimeout("search_profiles");
            assertEquals(1, monitor.rawLogSize());
        }

        @Test
        @DisplayName("should hide handler exceptions behind a generic 500")
        void handlerThrows() throws Exception {
            var response = run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> {
                        throw new IllegalStateException("connection to db-01 failed, password=hunter2");
                    });

            assertEquals(500, response.status());
            assertEquals("An unexpected error occurred", body(response).get("error").asText());
            assertFalse(response.body().contains("hunter2"));
            assertFalse(response.body().contains("db-01"));
        }

        @Test
        @DisplayName("should hide failed handler results behind a generic 500")
        void handlerFails() {
            var response = run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().failure(new RuntimeException("stack detail")));

            assertEquals(500, response.status());
            assertFalse(response.body().contains("stack detail"));
        }
    }

    @Nested
    @DisplayName("Output")
    class OutputTests {

        @Test
        @DisplayName("should answer OPTIONS with CORS headers only and no monitoring")
        void preflight() {
            var calls = new AtomicInteger();

            var response = run(request("OPTIONS"), EndpointPolicies.SEARCH_PROFILES, counting(calls, HandlerResult.ok(Map.of())));

            assertEquals(200, response.status());
            assertEquals("", response.body());
            assertEquals("*", response.header("Access-Control-Allow-Origin"));
            assertNull(response.header("X-Request-ID"));
            assertEquals(0, calls.get());
            assertEquals(0, monitor.rawLogSize());
        }

        @Test
        @DisplayName("should set protocol, rate-limit and security headers")
        void headers() {
            var response = run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().item(HandlerResult.ok(Map.of())));

            assertEquals("application/json", response.header("Content-Type"));
            assertEquals("MCP", response.header("X-API-Type"));
            assertEquals("1.0", response.header("X-API-Version"));
            assertTrue(response.header("X-Request-ID").startsWith("req_"));
            assertEquals("30", response.header("X-RateLimit-Limit"));
            assertEquals("29", response.header("X-RateLimit-Remaining"));
            assertEquals("nosniff", response.header("X-Content-Type-Options"));
            assertEquals("DENY", response.header("X-Frame-Options"));
            assertEquals("no-store", response.header("Cache-Control"));
            assertEquals("*", response.header("Access-Control-Allow-Origin"));
        }

        @Test
        @DisplayName("should make a hidden profile indistinguishable from a missing one")
        void hiddenLooksMissing() throws Exception {
            var hidden = run(
                    get("/api/mcp/get-profile", Map.of("slug", List.of("p1-slug"))),
                    EndpointPolicies.GET_PROFILE,
                    call -> Uni.createFrom().item(HandlerResult.found(profile("p1", "u1", false, true))));
            var missing = run(
                    get("/api/mcp/get-profile", Map.of("slug", List.of("nobody"))),
                    EndpointPolicies.GET_PROFILE,
                    call -> Uni.createFrom().item(HandlerResult.notFound()));

            assertEquals(404, hidden.status());
            assertEquals(missing.status(), hidden.status());
            var hiddenJson = body(hidden);
            var missingJson = body(missing);
            assertEquals(missingJson.get("error"), hiddenJson.get("error"));
            assertEquals(missingJson.get("code"), hiddenJson.get("code"));
            assertEquals(missingJson.has("details"), hiddenJson.has("details"));
            verify(metrics).recordPrivacyDenial("get_profile", "private");
            verify(publisher).publish(argThat(event -> event instanceof SecurityEvent.PrivacyDenied));
        }

        @Test
        @DisplayName("should return the agent projection of a visible profile")
        void visibleProfile() throws Exception {
            var response = run(
                    get("/api/mcp/get-profile", Map.of("slug", List.of("p1-slug"))),
                    EndpointPolicies.GET_PROFILE,
                    call -> Uni.createFrom().item(HandlerResult.found(publicProfile("p1", "u1"))));

            assertEquals(200, response.status());
            var json = body(response);
            assertEquals("p1-slug", json.at("/profile/slug").asText());
            assertFalse(json.get("profile").has("email"));
            assertFalse(json.get("profile").has("id"));
        }

        @Test
        @DisplayName("should page only visible profiles and count only them")
        void listing() throws Exception {
            var candidates = List.of(
                    publicProfile("p1", "u1"),
                    profile("p2", "u1", false, true),
                    profile("p3", "u1", true, false),
                    publicProfile("p4", "u2"));

            var response = run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().item(new HandlerResult.ProfileList(candidates, 1, 0)));

            var json = body(response);
            assertEquals(1, json.get("profiles").size());
            assertEquals(2, json.at("/pagination/total").asInt());
            assertTrue(json.at("/pagination/hasMore").asBoolean());
            assertFalse(response.body().contains("@private.example.com"));
        }

        @Test
        @DisplayName("should not report more pages past the end of a deep offset")
        void deepOffsetHasNoMore() throws Exception {
            var candidates = List.of(publicProfile("p1", "u1"), publicProfile("p2", "u1"));

            var response = run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().item(new HandlerResult.ProfileList(candidates, 10, Integer.MAX_VALUE)));

            var json = body(response);
            assertEquals(0, json.get("profiles").size());
            assertEquals(2, json.at("/pagination/total").asInt());
            assertFalse(json.at("/pagination/hasMore").asBoolean());
        }

        @Test
        @DisplayName("should record each request in the monitor exactly once")
        void monitoredOnce() {
            run(
                    get("/api/mcp/search-profiles", Map.of()),
                    EndpointPolicies.SEARCH_PROFILES,
                    call -> Uni.createFrom().item(HandlerResult.ok(Map.of())));
            run(request("DELETE"), EndpointPolicies.SEARCH_PROFILES, call -> Uni.createFrom().item(HandlerResult.ok(Map.of())));

            assertEquals(2, monitor.rawLogSize());
            verify(metrics).recordRequest(eq("search_profiles"), eq("GET"), eq(200), anyLong());
            verify(publisher, never()).publish(argThat(event -> event instanceof SecurityEvent.RateLimitExceeded));
        }
    }
}
