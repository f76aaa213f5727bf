package atrium.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import atrium.core.model.profile.Appointment;

/**
 * Port interface for storing contact requests.
 */
public interface AppointmentRepository {

    Uni<Appointment> save(Appointment appointment);

    Uni<List<Appointment>> findByProfileId(String profileId);
}
