package atrium.core.model.profile;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type of contact request an agent may file on behalf of a requester.
 */
public enum RequestType {
    MEETING(AvailabilityOption.MEETINGS),
    QUOTE(AvailabilityOption.QUOTES),
    APPOINTMENT(AvailabilityOption.APPOINTMENTS);

    private final AvailabilityOption requiredAvailability;

    RequestType(AvailabilityOption requiredAvailability) {
        this.requiredAvailability = requiredAvailability;
    }

    /** @return the availability option a profile must advertise to accept this request type */
    public AvailabilityOption requiredAvailability() {
        return requiredAvailability;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RequestType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
