package atrium.core.model.privacy;

/**
 * Where a profile representation is going. Each context has its own projection rules.
 */
public enum OutputContext {
    /** Web API where the owner may see their own private fields. */
    OWNER_API,
    /** Web API for other users. */
    PUBLIC_API,
    /** Machine-consumption protocol used by AI agents. */
    AGENT_PROTOCOL,
    /** Search and listing results. */
    SEARCH;

    /** @return true if the owner bypass never applies in this context */
    public boolean requiresPublicVisibility() {
        return this == AGENT_PROTOCOL;
    }
}
