package atrium.core.model.pipeline;

import java.util.List;

import atrium.core.model.common.ApiError;
import atrium.core.model.privacy.PrivacyViolation;
import atrium.core.model.profile.Profile;

/**
 * What a domain handler produced. Profiles are returned in canonical form and projected by the
 * pipeline, so handlers never decide which fields a caller sees.
 */
public sealed interface HandlerResult
        permits HandlerResult.ProfileFound,
                HandlerResult.ProfileList,
                HandlerResult.Payload,
                HandlerResult.NotFound,
                HandlerResult.Denied,
                HandlerResult.Rejected {

    record ProfileFound(Profile profile) implements HandlerResult {}

    /**
     * Candidates for a listing. The pipeline filters them for the viewer before paging, so
     * totals never count hidden profiles.
     */
    record ProfileList(List<Profile> candidates, int limit, int offset) implements HandlerResult {

        public ProfileList {
            candidates = candidates != null ? List.copyOf(candidates) : List.of();
        }
    }

    record Payload(int status, Object body) implements HandlerResult {}

    record NotFound() implements HandlerResult {}

    record Denied(PrivacyViolation violation) implements HandlerResult {}

    record Rejected(ApiError error) implements HandlerResult {}

    static HandlerResult found(Profile profile) {
        return new ProfileFound(profile);
    }

    static HandlerResult notFound() {
        return new NotFound();
    }

    static HandlerResult denied(PrivacyViolation violation) {
        return new Denied(violation);
    }

    static HandlerResult rejected(ApiError error) {
        return new Rejected(error);
    }

    static HandlerResult ok(Object body) {
        return new Payload(200, body);
    }

    static HandlerResult created(Object body) {
        return new Payload(201, body);
    }
}
