package atrium.core.model.common;

import java.util.List;

/**
 * Outcome of a security check.
 *
 * <p>Hard errors make the finding invalid and escalate the risk to {@link RiskLevel#MALICIOUS}.
 * Warnings alone leave it valid but {@link RiskLevel#SUSPICIOUS}.
 */
public record SecurityFinding(boolean isValid, RiskLevel riskLevel, List<String> errors, List<String> warnings) {

    private static final SecurityFinding SAFE = new SecurityFinding(true, RiskLevel.SAFE, List.of(), List.of());

    public SecurityFinding {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (riskLevel == null) {
            throw new IllegalArgumentException("riskLevel cannot be null");
        }
    }

    public static SecurityFinding safe() {
        return SAFE;
    }

    /**
     * Build a finding from collected errors and warnings.
     *
     * @param errors    hard failures
     * @param warnings  heuristic hits
     * @param malicious true when heuristics alone are strong enough to block
     */
    public static SecurityFinding of(List<String> errors, List<String> warnings, boolean malicious) {
        if (!errors.isEmpty() || malicious) {
            return new SecurityFinding(false, RiskLevel.MALICIOUS, errors, warnings);
        }
        if (!warnings.isEmpty()) {
            return new SecurityFinding(true, RiskLevel.SUSPICIOUS, errors, warnings);
        }
        return SAFE;
    }

    public boolean isSafe() {
        return riskLevel == RiskLevel.SAFE;
    }
}
