package atrium.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import atrium.core.config.CorsConfig;
import atrium.core.config.SecurityValidationConfig;
import atrium.core.model.common.CorsPolicy;

/**
 * Produces configuration-derived beans for injection into core services.
 * This bridges the config mappings to the core layer's value types.
 */
@ApplicationScoped
public class ConfigProducer {

    private final CorsConfig corsConfig;
    private final SecurityValidationConfig securityConfig;

    @Inject
    public ConfigProducer(CorsConfig corsConfig, SecurityValidationConfig securityConfig) {
        this.corsConfig = corsConfig;
        this.securityConfig = securityConfig;
    }

    @Produces
    @Singleton
    public CorsPolicy corsPolicy() {
        return new CorsPolicy(
                corsConfig.allowedOrigins().orElse(null),
                securityConfig.allowedMethods(),
                null,
                corsConfig.maxAge());
    }
}
