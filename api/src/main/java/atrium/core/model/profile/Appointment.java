package atrium.core.model.profile;

import java.time.Instant;
import java.util.Optional;

/**
 * A contact request filed against a profile. Always created in {@link Status#PENDING}.
 */
public record Appointment(
        String id,
        String profileId,
        String requesterName,
        String requesterEmail,
        String message,
        RequestType requestType,
        Optional<Instant> preferredTime,
        Status status,
        Instant createdAt) {

    public enum Status {
        PENDING,
        ACCEPTED,
        DECLINED
    }

    public Appointment {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Appointment id cannot be blank");
        }
        if (profileId == null || profileId.isBlank()) {
            throw new IllegalArgumentException("Appointment profileId cannot be blank");
        }
        if (requestType == null) {
            throw new IllegalArgumentException("Appointment requestType cannot be null");
        }
        preferredTime = preferredTime != null ? preferredTime : Optional.empty();
        status = status != null ? status : Status.PENDING;
    }
}
