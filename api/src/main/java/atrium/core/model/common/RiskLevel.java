package atrium.core.model.common;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk classification attached to a {@link SecurityFinding}.
 */
public enum RiskLevel {
    SAFE,
    SUSPICIOUS,
    MALICIOUS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
