package atrium.core.service.privacy;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import atrium.core.model.common.ApiError;
import atrium.core.model.common.ApiErrors;
import atrium.core.model.privacy.AccessAction;
import atrium.core.model.privacy.OutputContext;
import atrium.core.model.privacy.PrivacyViolation;
import atrium.core.model.privacy.ProfileProjection;
import atrium.core.model.profile.Profile;
import atrium.core.model.validation.ToolSchemas;

/**
 * Access-control decisions and context-dependent shaping for profiles.
 *
 * <p>Visibility rule: a profile is visible to its owner unconditionally, and to everyone else only
 * when it is both public and active. Denials are values, never exceptions, and every denial that
 * crosses the process boundary is rendered as a generic not-found so callers cannot tell a private
 * profile from a missing one.
 *
 * <p>This engine performs no I/O and is safe to call from any thread.
 */
@ApplicationScoped
public class PrivacyEngine {

    static final int MAX_PAGE_SIZE = ToolSchemas.MAX_PAGE_SIZE;

    private static final List<String> PRIVACY_REASON_MARKERS =
            List.of("private", "access", "self-contact", "inactive", "owner");

    // -------------------------------------------------------------------------
    // Decisions
    // -------------------------------------------------------------------------

    /**
     * @param resource the profile
     * @param viewerId the caller's user id, or null when anonymous
     * @return true if the caller may see the profile
     */
    public boolean canView(Profile resource, String viewerId) {
        Objects.requireNonNull(resource, "resource");
        return resource.isOwnedBy(viewerId) || resource.isExternallyVisible();
    }

    /**
     * Contact requires the profile to be public and active, and the caller not to be the owner.
     */
    public boolean canContact(Profile resource, String viewerId) {
        Objects.requireNonNull(resource, "resource");
        return resource.isExternallyVisible() && !resource.isOwnedBy(viewerId);
    }

    public boolean canEdit(Profile resource, String viewerId) {
        Objects.requireNonNull(resource, "resource");
        return resource.isOwnedBy(viewerId);
    }

    /**
     * Explain why an action is denied. For internal logging only.
     *
     * @return the violation, or empty when the action is allowed
     */
    public Optional<PrivacyViolation> violationReason(Profile resource, String viewerId, AccessAction action) {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
        return switch (action) {
            case VIEW -> resource.isOwnedBy(viewerId) ? Optional.empty() : visibilityViolation(resource);
            case CONTACT -> resource.isOwnedBy(viewerId)
                    ? Optional.of(PrivacyViolation.SELF_CONTACT)
                    : visibilityViolation(resource);
            case EDIT -> resource.isOwnedBy(viewerId) ? Optional.empty() : Optional.of(PrivacyViolation.NOT_OWNER);
        };
    }

    private Optional<PrivacyViolation> visibilityViolation(Profile resource) {
        if (!resource.isActive()) {
            return Optional.of(PrivacyViolation.INACTIVE);
        }
        if (!resource.isPublic()) {
            return Optional.of(PrivacyViolation.PRIVATE);
        }
        return Optional.empty();
    }

    /**
     * Whether an access should be written to the audit log: private profiles, contact attempts,
     * and owners viewing their own profile.
     */
    public boolean shouldLogAccess(Profile resource, String viewerId, AccessAction action) {
        Objects.requireNonNull(resource, "resource");
        if (!resource.isPublic() || action == AccessAction.CONTACT) {
            return true;
        }
        return action == AccessAction.VIEW && resource.isOwnedBy(viewerId);
    }

    /**
     * Only the owner may change visibility flags.
     *
     * @return the violation, or empty when the update is allowed
     */
    public Optional<PrivacyViolation> validatePrivacyUpdate(Profile resource, String viewerId) {
        return violationReason(resource, viewerId, AccessAction.EDIT);
    }

    /**
     * Check pagination bounds for a listing.
     *
     * @return a validation error, or empty when the window is acceptable
     */
    public Optional<ApiError> validateSearchWindow(int limit, int offset, OutputContext context) {
        final var max = context == OutputContext.AGENT_PROTOCOL ? ToolSchemas.MAX_AGENT_PAGE_SIZE : MAX_PAGE_SIZE;
        if (limit < 1 || limit > max) {
            return Optional.of(ApiErrors.validation("limit must be between 1 and " + max));
        }
        if (offset < 0 || offset > ToolSchemas.MAX_OFFSET) {
            return Optional.of(ApiErrors.validation("offset must be between 0 and " + ToolSchemas.MAX_OFFSET));
        }
        return Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Shaping
    // -------------------------------------------------------------------------

    /**
     * Project a profile for an output context.
     *
     * <p>The contact address appears only in the owner projection, which is returned only for
     * {@link OutputContext#OWNER_API} when the viewer owns the profile. Agent and search
     * projections never carry an internal id.
     *
     * @param resource the profile, must not be null
     * @param viewerId the caller's user id, or null when anonymous
     * @param context  the output context
     * @return the projection, or empty when the caller may not see the profile in this context
     * @throws NullPointerException if {@code resource} or {@code context} is null
     */
    public Optional<ProfileProjection> sanitizeForContext(Profile resource, String viewerId, OutputContext context) {
        Objects.requireNonNull(resource, "Cannot sanitize a null resource");
        Objects.requireNonNull(context, "context");
        if (!isVisibleIn(resource, viewerId, context)) {
            return Optional.empty();
        }
        final ProfileProjection projection = switch (context) {
            case OWNER_API -> resource.isOwnedBy(viewerId)
                    ? ProfileProjections.ownerProjection(resource)
                    : ProfileProjections.publicProjection(resource);
            case PUBLIC_API -> ProfileProjections.publicProjection(resource);
            case AGENT_PROTOCOL, SEARCH -> ProfileProjections.agentProjection(resource);
        };
        return Optional.of(projection);
    }

    /**
     * Keep the profiles a viewer may see in a listing.
     *
     * <p>Agent-protocol listings and anonymous searches require public and active profiles even
     * for the owner, so a caller's own private profiles never appear among public results.
     */
    public List<Profile> filterCollectionForViewer(List<Profile> resources, String viewerId, OutputContext context) {
        Objects.requireNonNull(resources, "resources");
        return resources.stream()
                .filter(Objects::nonNull)
                .filter(r -> isVisibleIn(r, viewerId, context))
                .toList();
    }

    private boolean isVisibleIn(Profile resource, String viewerId, OutputContext context) {
        if (context.requiresPublicVisibility() || (context == OutputContext.SEARCH && viewerId == null)) {
            return resource.isExternallyVisible();
        }
        return canView(resource, viewerId);
    }

    // -------------------------------------------------------------------------
    // Errors
    // -------------------------------------------------------------------------

    /**
     * Convert an internal violation into the error returned to callers. Every violation collapses
     * to the same not-found envelope.
     */
    public ApiError toPrivacySafeError(PrivacyViolation violation) {
        Objects.requireNonNull(violation, "violation");
        return ApiErrors.notFound();
    }

    /**
     * Convert a free-form internal reason. Reasons with privacy or access semantics collapse to
     * not-found; anything else, such as a malformed-input message, passes through as a
     * validation error.
     */
    public ApiError toPrivacySafeError(String internalReason) {
        if (internalReason == null || internalReason.isBlank()) {
            return ApiErrors.notFound();
        }
        final var normalized = internalReason.toLowerCase(Locale.ROOT);
        if (PRIVACY_REASON_MARKERS.stream().anyMatch(normalized::contains)) {
            return ApiErrors.notFound();
        }
        return ApiErrors.validation(internalReason);
    }
}
