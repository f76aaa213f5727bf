package atrium.core.service.directory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import atrium.core.config.DirectoryConfig;
import atrium.core.model.common.ApiErrors;
import atrium.core.model.pipeline.AgentCall;
import atrium.core.model.pipeline.HandlerResult;
import atrium.core.model.privacy.AccessAction;
import atrium.core.model.profile.Appointment;
import atrium.core.model.profile.AvailabilityOption;
import atrium.core.model.profile.Profile;
import atrium.core.model.profile.ProfileQuery;
import atrium.core.model.profile.RequestType;
import atrium.core.port.in.ProfileDirectory;
import atrium.core.port.out.AppointmentRepository;
import atrium.core.port.out.ProfileRepository;
import atrium.core.service.privacy.PrivacyEngine;

/**
 * Directory use cases behind the agent and web endpoints.
 *
 * <p>Handlers return canonical profiles; the request pipeline projects them for the caller.
 * Access decisions that depend on the action (contact, edit) are made here through the
 * {@link PrivacyEngine} and returned as {@link HandlerResult.Denied}.
 */
@ApplicationScoped
public class ProfileDirectoryService implements ProfileDirectory {

    private static final Logger LOG = Logger.getLogger(ProfileDirectoryService.class);

    private final ProfileRepository profiles;
    private final AppointmentRepository appointments;
    private final PrivacyEngine privacyEngine;
    private final DirectoryConfig config;
    private final Clock clock;

    @Inject
    public ProfileDirectoryService(
            ProfileRepository profiles,
            AppointmentRepository appointments,
            PrivacyEngine privacyEngine,
            DirectoryConfig config) {
        this(profiles, appointments, privacyEngine, config, Clock.systemUTC());
    }

    public ProfileDirectoryService(
            ProfileRepository profiles,
            AppointmentRepository appointments,
            PrivacyEngine privacyEngine,
            DirectoryConfig config,
            Clock clock) {
        this.profiles = profiles;
        this.appointments = appointments;
        this.privacyEngine = privacyEngine;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<HandlerResult> searchProfiles(AgentCall call) {
        final var limit = call.integer("limit", config.defaultPageSize());
        final var offset = call.integer("offset", 0);
        final var windowError = privacyEngine.validateSearchWindow(
                limit, offset, call.policy().outputContext());
        if (windowError.isPresent()) {
            return Uni.createFrom().item(HandlerResult.rejected(windowError.get()));
        }

        final var query = new ProfileQuery(
                Optional.ofNullable(call.text("query")),
                textValues(call.arguments().get("skills")),
                availabilityValues(call.arguments().get("availableFor")));

        return profiles.search(query).map(candidates -> {
            LOG.debugv("Search matched {0} candidate profiles", candidates.size());
            return new HandlerResult.ProfileList(candidates, limit, offset);
        });
    }

    @Override
    public Uni<HandlerResult> getProfile(AgentCall call) {
        final var slug = normalizeSlug(call.text("slug"));
        return profiles.findBySlug(slug).map(ProfileDirectoryService::foundOrNotFound);
    }

    @Override
    public Uni<HandlerResult> getProfileById(AgentCall call) {
        return profiles.findById(call.pathParam("id")).map(ProfileDirectoryService::foundOrNotFound);
    }

    @Override
    public Uni<HandlerResult> requestMeeting(AgentCall call) {
        final var slug = normalizeSlug(call.text("profileSlug"));
        return profiles.findBySlug(slug).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(HandlerResult.notFound());
            }
            final var profile = found.get();

            final var violation = privacyEngine.violationReason(profile, call.viewerId(), AccessAction.CONTACT);
            if (violation.isPresent()) {
                return Uni.createFrom().item(HandlerResult.denied(violation.get()));
            }

            final var requestType = RequestType.fromWireName(call.text("requestType"));
            if (requestType.isEmpty()) {
                return Uni.createFrom().item(HandlerResult.rejected(ApiErrors.validation("Unknown request type")));
            }
            if (!profile.accepts(requestType.get())) {
                return Uni.createFrom()
                        .item(HandlerResult.rejected(ApiErrors.validation(
                                "Profile is not accepting %s requests".formatted(requestType.get().wireName()))));
            }

            final Optional<Instant> preferredTime;
            try {
                preferredTime = parsePreferredTime(call.text("preferredTime"));
            } catch (DateTimeParseException e) {
                return Uni.createFrom().item(HandlerResult.rejected(ApiErrors.validation("Invalid preferred time")));
            }
            final var now = clock.instant();
            if (preferredTime.isPresent() && preferredTime.get().isBefore(now)) {
                return Uni.createFrom()
                        .item(HandlerResult.rejected(ApiErrors.validation("Preferred time must be in the future")));
            }

            final var appointment = new Appointment(
                    UUID.randomUUID().toString(),
                    profile.id(),
                    call.text("requesterName").trim(),
                    call.text("requesterEmail").trim(),
                    call.text("message").trim(),
                    requestType.get(),
                    preferredTime,
                    Appointment.Status.PENDING,
                    now);

            return appointments.save(appointment).map(saved -> {
                LOG.infov(
                        "Created {0} request {1} for profile {2}",
                        saved.requestType().wireName(),
                        saved.id(),
                        profile.slug());
                return HandlerResult.created(meetingCreatedBody(saved, profile));
            });
        });
    }

    @Override
    public Uni<HandlerResult> updatePrivacy(AgentCall call) {
        final var viewerId = call.viewerId();
        if (viewerId == null) {
            return Uni.createFrom().item(HandlerResult.rejected(ApiErrors.unauthenticated()));
        }

        return profiles.findById(call.pathParam("id")).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(HandlerResult.notFound());
            }
            final var profile = found.get();

            final var violation = privacyEngine.validatePrivacyUpdate(profile, viewerId);
            if (violation.isPresent()) {
                return Uni.createFrom().item(HandlerResult.denied(violation.get()));
            }

            final var args = call.arguments();
            final var isPublic = args.has("isPublic") ? args.get("isPublic").asBoolean() : profile.isPublic();
            final var isActive = args.has("isActive") ? args.get("isActive").asBoolean() : profile.isActive();

            return profiles.save(profile.withVisibility(isPublic, isActive, clock.instant()))
                    .map(saved -> {
                        LOG.infov(
                                "Updated visibility of profile {0}: public={1}, active={2}",
                                saved.id(),
                                saved.isPublic(),
                                saved.isActive());
                        return HandlerResult.found(saved);
                    });
        });
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static HandlerResult foundOrNotFound(Optional<Profile> profile) {
        return profile.map(HandlerResult::found).orElseGet(HandlerResult::notFound);
    }

    private static String normalizeSlug(String slug) {
        return slug != null ? slug.trim().toLowerCase(Locale.ROOT) : null;
    }

    private static Optional<Instant> parsePreferredTime(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(OffsetDateTime.parse(value.trim()).toInstant());
    }

    private static List<String> textValues(JsonNode node) {
        final var values = new ArrayList<String>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            });
        }
        return values;
    }

    private static EnumSet<AvailabilityOption> availabilityValues(JsonNode node) {
        final var options = EnumSet.noneOf(AvailabilityOption.class);
        textValues(node).forEach(value -> AvailabilityOption.fromWireName(value).ifPresent(options::add));
        return options;
    }

    private static Map<String, Object> meetingCreatedBody(Appointment appointment, Profile profile) {
        final var details = new LinkedHashMap<String, Object>();
        details.put("profileName", profile.name());
        details.put("requestType", appointment.requestType().wireName());
        details.put("status", appointment.status().name().toLowerCase(Locale.ROOT));
        details.put("createdAt", appointment.createdAt().toString());

        final var body = new LinkedHashMap<String, Object>();
        body.put("success", true);
        body.put("requestId", appointment.id());
        body.put("message", "Meeting request sent successfully to " + profile.name());
        body.put("details", details);
        return body;
    }
}
