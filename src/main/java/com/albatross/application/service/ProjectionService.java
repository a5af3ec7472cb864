package com.albatross.application.service;

import com.albatross.application.port.in.ProjectEventUseCase;
import com.albatross.application.port.out.ApiKeyReadModel;
import com.albatross.application.port.out.ApiKeyReadModel.ApiKeyView;
import com.albatross.application.port.out.EventCodec;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.Notification;
import com.albatross.application.port.out.NotificationException;
import com.albatross.application.port.out.NotificationPublisher;
import com.albatross.application.port.out.PirepReadModel;
import com.albatross.application.port.out.PirepReadModel.PirepView;
import com.albatross.application.port.out.TenantReadModel;
import com.albatross.application.port.out.TenantReadModel.TenantView;
import com.albatross.application.port.out.UserReadModel;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.event.DomainEvent;
import com.albatross.domain.event.EventType;
import com.albatross.domain.event.PirepEvent;
import com.albatross.domain.event.TenantEvent;
import com.albatross.domain.event.UserEvent;
import com.albatross.domain.model.NotificationChannels;
import com.albatross.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies bus events to the relational read models and announces each change on a notification channel.
 * Every insert is idempotent on the event's own ids, so redelivered events are skipped.
 */
@Service
public class ProjectionService implements ProjectEventUseCase {

    private static final Logger log = LoggerFactory.getLogger(ProjectionService.class);

    private final EventCodec eventCodec;
    private final TenantReadModel tenantReadModel;
    private final UserReadModel userReadModel;
    private final ApiKeyReadModel apiKeyReadModel;
    private final PirepReadModel pirepReadModel;
    private final NotificationPublisher notificationPublisher;
    private final MetricsPort metrics;

    public ProjectionService(
            EventCodec eventCodec,
            TenantReadModel tenantReadModel,
            UserReadModel userReadModel,
            ApiKeyReadModel apiKeyReadModel,
            PirepReadModel pirepReadModel,
            NotificationPublisher notificationPublisher,
            MetricsPort metrics) {
        this.eventCodec = eventCodec;
        this.tenantReadModel = tenantReadModel;
        this.userReadModel = userReadModel;
        this.apiKeyReadModel = apiKeyReadModel;
        this.pirepReadModel = pirepReadModel;
        this.notificationPublisher = notificationPublisher;
        this.metrics = metrics;
    }

    @Override
    public Result<Outcome, CoreError> project(String eventType, String aggregateId, Long sequence, byte[] payload) {
        Optional<EventType> type = EventType.fromName(eventType);
        if (type.isEmpty()) {
            log.warn("Unknown event type: {}", eventType);
            metrics.incrementProjectionsSkipped();
            return Result.success(Outcome.SKIPPED);
        }

        Result<DomainEvent, CoreError> decoded = eventCodec.decode(eventType, payload);
        if (decoded.isFailure()) {
            log.error("Failed to decode event: type={}, aggregateId={}, error={}",
                eventType, aggregateId, decoded.errorOrNull().message());
            return Result.failure(decoded.errorOrNull());
        }

        DomainEvent event = decoded.getOrThrow();
        Result<Outcome, CoreError> result = metrics.recordProjection(() -> apply(type.get(), event, sequence));
        if (result.isSuccess()) {
            if (result.getOrThrow() == Outcome.APPLIED) {
                metrics.incrementProjectionsApplied();
            } else {
                metrics.incrementProjectionsSkipped();
            }
        }
        return result;
    }

    private Result<Outcome, CoreError> apply(EventType type, DomainEvent event, Long sequence) {
        log.debug("Projecting event: type={}, aggregateId={}, sequence={}", type.typeName(), event.aggregateId(), sequence);
        try {
            Outcome outcome = switch (type) {
                case TENANT_CREATED -> projectTenantCreated((TenantEvent.Created) event, sequence);
                case USER_REGISTERED -> projectUserRegistered((UserEvent.Registered) event, sequence);
                case PASSWORD_CHANGED -> projectPasswordChanged((UserEvent.PasswordChanged) event, sequence);
                case USER_LOGGED_IN -> projectUserLoggedIn((UserEvent.LoggedIn) event);
                case API_KEY_GENERATED -> projectApiKeyGenerated((UserEvent.ApiKeyGenerated) event, sequence);
                case API_KEY_REVOKED -> projectApiKeyRevoked((UserEvent.ApiKeyRevoked) event, sequence);
                case PIREP_SUBMITTED -> projectPirepSubmitted((PirepEvent.Submitted) event, sequence);
            };
            return Result.success(outcome);
        } catch (DataAccessException e) {
            log.error("Failed to apply projection: type={}, aggregateId={}", type.typeName(), event.aggregateId(), e);
            return Result.failure(new CoreError.Infrastructure("Projection failed: " + e.getMessage()));
        }
    }

    private Outcome projectTenantCreated(TenantEvent.Created event, Long sequence) {
        boolean inserted = tenantReadModel.insert(new TenantView(event.tenantId(), event.name(), event.occurredAt()));
        if (!inserted) {
            log.debug("Tenant already projected: tenantId={}", event.tenantId());
            return Outcome.SKIPPED;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tenant_id", event.tenantId());
        data.put("name", event.name());
        notify(NotificationChannels.tenantUpdates(event.tenantId()), event, data, sequence);
        return Outcome.APPLIED;
    }

    private Outcome projectUserRegistered(UserEvent.Registered event, Long sequence) {
        boolean inserted = userReadModel.insert(new UserView(
            event.userId(),
            event.tenantId(),
            event.username(),
            event.email(),
            event.role(),
            event.passwordHash(),
            event.occurredAt(),
            null
        ));
        if (!inserted) {
            log.debug("User already projected: userId={}", event.userId());
            return Outcome.SKIPPED;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", event.userId());
        data.put("username", event.username());
        data.put("email", event.email());
        data.put("role", event.role().label());
        data.put("tenant_id", event.tenantId());
        notify(NotificationChannels.userUpdates(event.userId()), event, data, sequence);
        return Outcome.APPLIED;
    }

    private Outcome projectPasswordChanged(UserEvent.PasswordChanged event, Long sequence) {
        int updated = userReadModel.updatePasswordHash(event.userId(), event.passwordHash());
        if (updated == 0) {
            log.warn("Password change for unprojected user: userId={}", event.userId());
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", event.userId());
        data.put("change", "password");
        notify(NotificationChannels.userUpdates(event.userId()), event, data, sequence);
        return Outcome.APPLIED;
    }

    private Outcome projectUserLoggedIn(UserEvent.LoggedIn event) {
        int updated = userReadModel.updateLastLogin(event.userId(), event.occurredAt());
        if (updated == 0) {
            log.warn("Login recorded for unprojected user: userId={}", event.userId());
        }
        return Outcome.APPLIED;
    }

    private Outcome projectApiKeyGenerated(UserEvent.ApiKeyGenerated event, Long sequence) {
        boolean inserted = apiKeyReadModel.insert(
            new ApiKeyView(event.keyId(), event.userId(), event.tenantId(), event.keyName(), event.occurredAt(), null),
            event.apiKeyHash());
        if (!inserted) {
            log.debug("API key already projected: keyId={}", event.keyId());
            return Outcome.SKIPPED;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", event.userId());
        data.put("key_id", event.keyId());
        data.put("key_name", event.keyName());
        data.put("action", "generated");
        notify(NotificationChannels.userApiKeys(event.userId()), event, data, sequence);
        return Outcome.APPLIED;
    }

    private Outcome projectApiKeyRevoked(UserEvent.ApiKeyRevoked event, Long sequence) {
        int revoked = apiKeyReadModel.revoke(event.keyId(), event.occurredAt());
        if (revoked == 0) {
            log.warn("Revoked API key not found or already revoked: keyId={}", event.keyId());
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", event.userId());
        data.put("key_id", event.keyId());
        data.put("action", "revoked");
        notify(NotificationChannels.userApiKeys(event.userId()), event, data, sequence);
        return Outcome.APPLIED;
    }

    private Outcome projectPirepSubmitted(PirepEvent.Submitted event, Long sequence) {
        boolean inserted = pirepReadModel.insert(new PirepView(
            event.pirepId(),
            event.tenantId(),
            event.userId(),
            event.aircraftId(),
            event.departureIcao(),
            event.arrivalIcao(),
            event.flightNumber(),
            event.flightTimeHours(),
            event.remarks(),
            event.occurredAt()
        ));
        if (!inserted) {
            log.debug("Pirep already projected: pirepId={}", event.pirepId());
            return Outcome.SKIPPED;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pirep_id", event.pirepId());
        data.put("user_id", event.userId());
        data.put("flight_number", event.flightNumber());
        data.put("departure_icao", event.departureIcao());
        data.put("arrival_icao", event.arrivalIcao());
        data.put("flight_time_hours", event.flightTimeHours());
        notify(NotificationChannels.tenantUpdates(event.tenantId()), event, data, sequence);
        return Outcome.APPLIED;
    }

    private void notify(String channel, DomainEvent event, Map<String, Object> data, Long sequence) {
        Notification notification = new Notification(
            event.eventType(), Instant.now(), data, event.tenantId(), event.aggregateId(), sequence);
        try {
            notificationPublisher.publish(channel, notification);
            metrics.incrementNotificationsPublished();
        } catch (NotificationException e) {
            log.warn("Notification not delivered: channel={}, type={}, error={}", channel, event.eventType(), e.getMessage());
        }
    }
}
