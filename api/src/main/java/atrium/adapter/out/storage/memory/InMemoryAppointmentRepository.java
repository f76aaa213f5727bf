package atrium.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import atrium.core.model.profile.Appointment;
import atrium.core.port.out.AppointmentRepository;

/**
 * In-memory implementation of AppointmentRepository.
 *
 * <p>Data is NOT persisted across restarts.
 */
@ApplicationScoped
public class InMemoryAppointmentRepository implements AppointmentRepository {

    private final ConcurrentHashMap<String, Appointment> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Appointment> save(Appointment appointment) {
        return Uni.createFrom().item(() -> {
            storage.put(appointment.id(), appointment);
            return appointment;
        });
    }

    @Override
    public Uni<List<Appointment>> findByProfileId(String profileId) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(a -> a.profileId().equals(profileId))
                .sorted(Comparator.comparing(Appointment::createdAt))
                .toList());
    }
}
