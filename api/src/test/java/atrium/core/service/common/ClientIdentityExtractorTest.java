package atrium.core.service.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import atrium.adapter.out.identity.HeaderIdentityProvider;
import atrium.core.model.common.InboundRequest;
import atrium.core.model.common.RequestHeaders;

@DisplayName("ClientIdentityExtractor")
class ClientIdentityExtractorTest {

    private final ClientIdentityExtractor extractor = new ClientIdentityExtractor(new HeaderIdentityProvider());

    private static InboundRequest request(Map<String, String> headers, String remoteAddress) {
        return new InboundRequest(
                "GET", "/api/mcp/health", null, RequestHeaders.single(headers), null, null, null, remoteAddress);
    }

    @Nested
    @DisplayName("IP resolution")
    class IpTests {

        @Test
        @DisplayName("should prefer the Forwarded header")
        void forwardedFirst() {
            var headers = RequestHeaders.single(Map.of(
                    "Forwarded", "for=192.0.2.60;proto=http, for=198.51.100.17",
                    "X-Forwarded-For", "203.0.113.1"));

            assertEquals("192.0.2.60", ClientIdentityExtractor.extractIp(headers, "10.0.0.1"));
        }

        @Test
        @DisplayName("should use the first X-Forwarded-For entry")
        void xForwardedFor() {
            var headers = RequestHeaders.single(Map.of("X-Forwarded-For", "1.2.3.4, 10.0.0.2"));

            assertEquals("1.2.3.4", ClientIdentityExtractor.extractIp(headers, "10.0.0.1"));
        }

        @Test
        @DisplayName("should fall back through X-Real-IP and CF-Connecting-IP to the socket")
        void fallbacks() {
            assertEquals(
                    "5.6.7.8",
                    ClientIdentityExtractor.extractIp(RequestHeaders.single(Map.of("X-Real-IP", "5.6.7.8")), null));
            assertEquals(
                    "9.9.9.9",
                    ClientIdentityExtractor.extractIp(
                            RequestHeaders.single(Map.of("CF-Connecting-IP", "9.9.9.9")), null));
            assertEquals("10.0.0.1", ClientIdentityExtractor.extractIp(RequestHeaders.empty(), "10.0.0.1"));
            assertEquals("unknown", ClientIdentityExtractor.extractIp(RequestHeaders.empty(), null));
        }

        @Test
        @DisplayName("should strip ports and IPv6 brackets from Forwarded")
        void forwardedForms() {
            assertEquals("192.0.2.43", ClientIdentityExtractor.parseForwardedFor("for=192.0.2.43:47011"));
            assertEquals(
                    "2001:db8:cafe::17", ClientIdentityExtractor.parseForwardedFor("for=\"[2001:db8:cafe::17]:4711\""));
            assertNull(ClientIdentityExtractor.parseForwardedFor("proto=https"));
        }

        @Test
        @DisplayName("should match the for= parameter case-insensitively regardless of default locale")
        void forwardedParameterCase() {
            var previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                assertEquals("192.0.2.60", ClientIdentityExtractor.parseForwardedFor("proto=http;FOR=192.0.2.60"));
                assertEquals("192.0.2.61", ClientIdentityExtractor.parseForwardedFor("For=192.0.2.61;by=203.0.113.43"));
            } finally {
                Locale.setDefault(previous);
            }
        }
    }

    @Nested
    @DisplayName("Identity")
    class IdentityTests {

        @Test
        @DisplayName("should key anonymous callers by IP and user agent")
        void anonymousKey() {
            var identity = extractor.extract(request(Map.of("User-Agent", "agent/1.0"), "1.2.3.4"));

            assertEquals("ip:1.2.3.4:agent/1.0", identity.rateLimitKey());
            assertNull(identity.viewerId());
        }

        @Test
        @DisplayName("should key authenticated callers by user id")
        void authenticatedKey() {
            var identity = extractor.extract(request(Map.of("X-User-ID", " u1 "), "1.2.3.4"));

            assertEquals("user:u1", identity.rateLimitKey());
            assertEquals("u1", identity.viewerId());
        }

        @Test
        @DisplayName("should treat 'anonymous' as no user")
        void anonymousUserHeader() {
            var identity = extractor.extract(request(Map.of("X-User-ID", "Anonymous"), "1.2.3.4"));

            assertTrue(identity.authenticatedUserId().isEmpty());
        }

        @Test
        @DisplayName("should truncate long user agents in the key")
        void truncatedUserAgent() {
            var identity = extractor.extract(request(Map.of("User-Agent", "x".repeat(80)), "1.2.3.4"));

            assertEquals("ip:1.2.3.4:" + "x".repeat(50), identity.rateLimitKey());
        }
    }
}
