package atrium.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import atrium.core.model.profile.Profile;
import atrium.core.model.profile.ProfileQuery;
import atrium.core.port.out.ProfileRepository;

/**
 * In-memory implementation of ProfileRepository.
 *
 * <p>Data is NOT persisted across restarts. Slugs are indexed separately so lookups by slug do
 * not scan the store; a save that changes a profile's slug drops the old index entry.
 */
@ApplicationScoped
public class InMemoryProfileRepository implements ProfileRepository {

    private static final Comparator<Profile> NEWEST_FIRST =
            Comparator.comparing(Profile::createdAt).reversed().thenComparing(Profile::id);

    private final ConcurrentHashMap<String, Profile> storage = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idsBySlug = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<Profile>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(id).map(storage::get));
    }

    @Override
    public Uni<Optional<Profile>> findBySlug(String slug) {
        return Uni.createFrom().item(() -> Optional.ofNullable(slug)
                .map(idsBySlug::get)
                .map(storage::get));
    }

    @Override
    public Uni<List<Profile>> search(ProfileQuery query) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .toList());
    }

    @Override
    public Uni<Profile> save(Profile profile) {
        return Uni.createFrom().item(() -> {
            final var previous = storage.put(profile.id(), profile);
            if (previous != null && !previous.slug().equals(profile.slug())) {
                idsBySlug.remove(previous.slug(), previous.id());
            }
            idsBySlug.put(profile.slug(), profile.id());
            return profile;
        });
    }

    public int size() {
        return storage.size();
    }
}
