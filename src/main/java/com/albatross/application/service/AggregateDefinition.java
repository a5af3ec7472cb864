package com.albatross.application.service;

import com.albatross.domain.command.PirepCommand;
import com.albatross.domain.command.TenantCommand;
import com.albatross.domain.command.UserCommand;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.error.PirepError;
import com.albatross.domain.error.TenantError;
import com.albatross.domain.error.UserError;
import com.albatross.domain.event.DomainEvent;
import com.albatross.domain.event.PirepEvent;
import com.albatross.domain.event.TenantEvent;
import com.albatross.domain.event.UserEvent;
import com.albatross.domain.model.Aggregate;
import com.albatross.domain.model.AggregateKind;
import com.albatross.domain.model.Pirep;
import com.albatross.domain.model.Tenant;
import com.albatross.domain.model.User;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything the executor needs to rebuild and run one aggregate type.
 */
public record AggregateDefinition<A extends Aggregate<C, E, X>, C, E extends DomainEvent, X>(
    AggregateKind kind,
    Supplier<A> factory,
    Class<E> eventClass,
    Function<X, CoreError> errorMapper
) {

    public static final AggregateDefinition<User, UserCommand, UserEvent, UserError> USER =
        new AggregateDefinition<>(AggregateKind.USER, User::new, UserEvent.class, UserError::toCoreError);

    public static final AggregateDefinition<Tenant, TenantCommand, TenantEvent, TenantError> TENANT =
        new AggregateDefinition<>(AggregateKind.TENANT, Tenant::new, TenantEvent.class, TenantError::toCoreError);

    public static final AggregateDefinition<Pirep, PirepCommand, PirepEvent, PirepError> PIREP =
        new AggregateDefinition<>(AggregateKind.PIREP, Pirep::new, PirepEvent.class, PirepError::toCoreError);
}
