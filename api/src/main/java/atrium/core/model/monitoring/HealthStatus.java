package atrium.core.model.monitoring;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
