package atrium.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the agent request pipeline.
 *
 * <p>Configuration prefix: {@code atrium.pipeline}
 */
@ConfigMapping(prefix = "atrium.pipeline")
public interface PipelineConfig {

    /**
     * Upper bound on handler execution. Exceeding it yields 504 and a failed monitoring record.
     *
     * @return request timeout (default: 30s)
     */
    @WithDefault("30s")
    Duration timeout();

    /**
     * @return value of the {@code X-API-Version} header (default: 1.0)
     */
    @WithName("api-version")
    @WithDefault("1.0")
    String apiVersion();

    /**
     * @return value of the {@code Content-Security-Policy} header
     */
    @WithName("content-security-policy")
    @WithDefault("default-src 'none'; frame-ancestors 'none';")
    String contentSecurityPolicy();
}
