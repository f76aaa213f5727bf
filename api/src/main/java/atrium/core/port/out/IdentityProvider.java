package atrium.core.port.out;

import java.util.Optional;

import atrium.core.model.common.RequestHeaders;

/**
 * Port interface for resolving the authenticated user behind a request.
 *
 * <p>Authentication itself happens upstream; this port only reads its result.
 */
public interface IdentityProvider {

    /**
     * @param headers request headers
     * @return the authenticated user id, or empty for anonymous callers
     */
    Optional<String> authenticatedUserId(RequestHeaders headers);
}
