package com.albatross.domain.event;

import com.albatross.domain.model.AggregateKind;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The single table of event types: wire name, owning aggregate and record class.
 * Every decoder and dispatcher goes through here instead of matching on string literals.
 */
public enum EventType {
    TENANT_CREATED("TenantCreated", AggregateKind.TENANT, TenantEvent.Created.class),
    USER_REGISTERED("UserRegistered", AggregateKind.USER, UserEvent.Registered.class),
    PASSWORD_CHANGED("PasswordChanged", AggregateKind.USER, UserEvent.PasswordChanged.class),
    API_KEY_GENERATED("ApiKeyGenerated", AggregateKind.USER, UserEvent.ApiKeyGenerated.class),
    API_KEY_REVOKED("ApiKeyRevoked", AggregateKind.USER, UserEvent.ApiKeyRevoked.class),
    USER_LOGGED_IN("UserLoggedIn", AggregateKind.USER, UserEvent.LoggedIn.class),
    PIREP_SUBMITTED("PirepSubmitted", AggregateKind.PIREP, PirepEvent.Submitted.class);

    private static final Map<String, EventType> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EventType::typeName, Function.identity()));

    private static final Map<Class<? extends DomainEvent>, EventType> BY_CLASS = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EventType::eventClass, Function.identity()));

    private final String typeName;
    private final AggregateKind kind;
    private final Class<? extends DomainEvent> eventClass;

    EventType(String typeName, AggregateKind kind, Class<? extends DomainEvent> eventClass) {
        this.typeName = typeName;
        this.kind = kind;
        this.eventClass = eventClass;
    }

    public String typeName() {
        return typeName;
    }

    public AggregateKind kind() {
        return kind;
    }

    public Class<? extends DomainEvent> eventClass() {
        return eventClass;
    }

    public static Optional<EventType> fromName(String typeName) {
        return Optional.ofNullable(typeName).map(BY_NAME::get);
    }

    public static EventType of(DomainEvent event) {
        EventType type = BY_CLASS.get(event.getClass());
        if (type == null) {
            throw new IllegalStateException("Unregistered event class: " + event.getClass().getName());
        }
        return type;
    }
}
