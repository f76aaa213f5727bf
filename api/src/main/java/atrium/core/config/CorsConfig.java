package atrium.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for CORS on agent-facing endpoints.
 *
 * <p>Configuration prefix: {@code atrium.cors}
 */
@ConfigMapping(prefix = "atrium.cors")
public interface CorsConfig {

    /**
     * Allowed origins; {@code *.example.com} matches subdomains. Unset means any origin.
     */
    @WithName("allowed-origins")
    Optional<List<String>> allowedOrigins();

    /**
     * @return preflight cache duration in seconds (default: 86400)
     */
    @WithName("max-age")
    @WithDefault("86400")
    long maxAge();
}
