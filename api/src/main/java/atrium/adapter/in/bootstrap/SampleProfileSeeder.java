package atrium.adapter.in.bootstrap;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import atrium.core.config.DirectoryConfig;
import atrium.core.model.profile.AvailabilityOption;
import atrium.core.model.profile.Profile;
import atrium.core.port.out.ProfileRepository;

/**
 * Loads sample profiles on startup when {@code atrium.directory.seed-sample-profiles} is set.
 *
 * <p>The set covers each visibility state: public and active, private, and inactive.
 */
@ApplicationScoped
public class SampleProfileSeeder {

    private static final Logger LOG = Logger.getLogger(SampleProfileSeeder.class);

    private final ProfileRepository repository;
    private final DirectoryConfig config;

    @Inject
    public SampleProfileSeeder(ProfileRepository repository, DirectoryConfig config) {
        this.repository = repository;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.seedSampleProfiles()) {
            LOG.debug("Sample profile seeding is disabled");
            return;
        }

        final var profiles = sampleProfiles(Instant.now());
        for (final var profile : profiles) {
            repository.save(profile).await().atMost(Duration.ofSeconds(5));
        }
        LOG.infov("Seeded {0} sample profiles", profiles.size());
    }

    static List<Profile> sampleProfiles(Instant now) {
        return List.of(
                new Profile(
                        "p-ada", "user-ada", "ada-lovelace", "Ada Lovelace", "ada@example.com",
                        "Analytical engine programmer.", "Mathematician", "London",
                        List.of("mathematics", "algorithms"),
                        Set.of(AvailabilityOption.MEETINGS, AvailabilityOption.QUOTES),
                        "https://www.linkedin.com/in/ada", Map.of("website", "https://ada.example.com"),
                        true, true, now.minus(Duration.ofDays(3)), null),
                new Profile(
                        "p-grace", "user-grace", "grace-hopper", "Grace Hopper", "grace@example.com",
                        "Compiler pioneer.", "Rear Admiral", "Arlington",
                        List.of("compilers", "cobol"),
                        Set.of(AvailabilityOption.MEETINGS, AvailabilityOption.APPOINTMENTS),
                        null, Map.of(),
                        true, true, now.minus(Duration.ofDays(2)), null),
                new Profile(
                        "p-hidden", "user-hidden", "hidden-person", "Hidden Person", "hidden@example.com",
                        "Prefers privacy.", "Consultant", "Unknown",
                        List.of("algorithms"),
                        Set.of(AvailabilityOption.MEETINGS),
                        null, Map.of(),
                        false, true, now.minus(Duration.ofDays(1)), null),
                new Profile(
                        "p-retired", "user-retired", "retired-person", "Retired Person", "retired@example.com",
                        "No longer taking work.", "Retired", "Lisbon",
                        List.of("cobol"),
                        Set.of(AvailabilityOption.QUOTES),
                        null, Map.of(),
                        true, false, now, null));
    }
}
