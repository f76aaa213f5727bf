package atrium.core.model.profile;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of requests a profile owner is open to.
 */
public enum AvailabilityOption {
    MEETINGS,
    QUOTES,
    APPOINTMENTS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AvailabilityOption> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(o -> o.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
