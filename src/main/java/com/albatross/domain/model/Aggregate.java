package com.albatross.domain.model;

import com.albatross.domain.event.DomainEvent;

import java.util.List;

/**
 * Consistency boundary whose state is derived entirely by folding its events.
 *
 * @param <C> command type
 * @param <E> event type
 * @param <X> rejection type
 */
public interface Aggregate<C, E extends DomainEvent, X> {

    /**
     * Null until the first event has been applied.
     */
    String aggregateId();

    /**
     * Number of events applied so far.
     */
    long version();

    /**
     * Folds one event into state. Never fails and increments the version by exactly one.
     */
    void apply(E event);

    /**
     * Decides which events a command produces. Must not change state.
     */
    Result<List<E>, X> handle(C command);
}
