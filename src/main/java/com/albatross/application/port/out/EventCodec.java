package com.albatross.application.port.out;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.event.DomainEvent;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Result;

/**
 * Converts domain events to and from their stored payload, keyed by the registered event type name.
 */
public interface EventCodec {

    Result<NewEvent, CoreError> encode(DomainEvent event);

    /**
     * Fails with {@link CoreError.Deserialization} for unknown type names and malformed payloads.
     */
    Result<DomainEvent, CoreError> decode(String eventType, byte[] payload);
}
