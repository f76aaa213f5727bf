package atrium.adapter.out.identity;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import atrium.core.model.common.RequestHeaders;
import atrium.core.port.out.IdentityProvider;

/**
 * Reads the authenticated user id from the {@code X-User-ID} header set by the upstream
 * authentication layer. Blank values and the literal {@code anonymous} mean no user.
 */
@ApplicationScoped
public class HeaderIdentityProvider implements IdentityProvider {

    public static final String USER_ID_HEADER = "X-User-ID";

    private static final String ANONYMOUS = "anonymous";

    @Override
    public Optional<String> authenticatedUserId(RequestHeaders headers) {
        return headers.first(USER_ID_HEADER)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .filter(id -> !ANONYMOUS.equalsIgnoreCase(id));
    }
}
