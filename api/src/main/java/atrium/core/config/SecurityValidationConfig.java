package atrium.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for request security validation.
 *
 * <p>Configuration prefix: {@code atrium.security}
 */
@ConfigMapping(prefix = "atrium.security")
public interface SecurityValidationConfig {

    /**
     * @return maximum request body size in bytes (default: 1 MiB)
     */
    @WithName("max-body-size")
    @WithDefault("1048576")
    long maxBodySize();

    /**
     * @return maximum request URL length (default: 2048)
     */
    @WithName("max-url-length")
    @WithDefault("2048")
    int maxUrlLength();

    /**
     * @return maximum JSON nesting depth (default: 10)
     */
    @WithName("max-json-depth")
    @WithDefault("10")
    int maxJsonDepth();

    /**
     * Strings longer than this are reported as suspicious.
     *
     * @return threshold in characters (default: 10000)
     */
    @WithName("max-string-length")
    @WithDefault("10000")
    int maxStringLength();

    /**
     * Number of script-pattern hits in one request at which the request is treated as malicious
     * and blocked instead of only logged.
     *
     * @return hit threshold (default: 3)
     */
    @WithName("malicious-pattern-threshold")
    @WithDefault("3")
    int maliciousPatternThreshold();

    /**
     * @return methods accepted by any endpoint (default: GET, POST, OPTIONS)
     */
    @WithName("allowed-methods")
    @WithDefault("GET,POST,OPTIONS")
    List<String> allowedMethods();

    /**
     * @return case-insensitive regex for automated user agents (default: bot|crawler|spider|scraper)
     */
    @WithName("flagged-user-agent-pattern")
    @WithDefault("bot|crawler|spider|scraper")
    String flaggedUserAgentPattern();

    /**
     * @return case-insensitive substrings that indicate script injection
     */
    @WithName("suspicious-patterns")
    @WithDefault("<script,javascript:,vbscript:,onload=,onerror=")
    List<String> suspiciousPatterns();
}
