package atrium.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import atrium.core.model.profile.Profile;
import atrium.core.model.profile.ProfileQuery;

/**
 * Port interface for profile storage.
 *
 * <p>Repositories return canonical profiles regardless of visibility. Access decisions are made
 * by the privacy engine, never by storage.
 */
public interface ProfileRepository {

    Uni<Optional<Profile>> findById(String id);

    Uni<Optional<Profile>> findBySlug(String slug);

    /**
     * Find profiles matching a query, ordered by creation time, newest first.
     */
    Uni<List<Profile>> search(ProfileQuery query);

    /**
     * Insert or replace a profile.
     */
    Uni<Profile> save(Profile profile);
}
