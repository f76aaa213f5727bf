package atrium.core.model.profile;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Search criteria for the directory. All criteria are optional and combined with AND.
 */
public record ProfileQuery(Optional<String> text, List<String> skills, Set<AvailabilityOption> availableFor) {

    public ProfileQuery {
        text = text != null ? text.map(String::trim).filter(t -> !t.isEmpty()) : Optional.empty();
        skills = skills != null ? List.copyOf(skills) : List.of();
        availableFor = availableFor != null ? Set.copyOf(availableFor) : Set.of();
    }

    public static ProfileQuery all() {
        return new ProfileQuery(Optional.empty(), List.of(), Set.of());
    }

    /**
     * Tests whether a profile matches. Text matches name, headline, bio or any skill,
     * case-insensitively. Every requested skill must be present. Any requested availability
     * option is enough.
     */
    public boolean matches(Profile profile) {
        if (text.isPresent()) {
            final var needle = text.get().toLowerCase(Locale.ROOT);
            final var hit = contains(profile.name(), needle)
                    || contains(profile.headline(), needle)
                    || contains(profile.bio(), needle)
                    || profile.skills().stream().anyMatch(s -> contains(s, needle));
            if (!hit) {
                return false;
            }
        }
        for (final var skill : skills) {
            final var wanted = skill.toLowerCase(Locale.ROOT);
            if (profile.skills().stream().noneMatch(s -> s.toLowerCase(Locale.ROOT).equals(wanted))) {
                return false;
            }
        }
        if (!availableFor.isEmpty()) {
            return availableFor.stream().anyMatch(profile.availableFor()::contains);
        }
        return true;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
