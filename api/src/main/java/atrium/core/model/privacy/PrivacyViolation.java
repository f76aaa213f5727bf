package atrium.core.model.privacy;

/**
 * Internal reason an access was denied.
 *
 * <p>These reasons are for logs and audit events only. They are converted to a generic not-found
 * error before anything leaves the process.
 */
public enum PrivacyViolation {
    PRIVATE("private"),
    INACTIVE("inactive"),
    SELF_CONTACT("self-contact"),
    NOT_OWNER("not-owner");

    private final String reason;

    PrivacyViolation(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
