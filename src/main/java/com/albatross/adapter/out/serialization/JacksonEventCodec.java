package com.albatross.adapter.out.serialization;

import com.albatross.application.port.out.EventCodec;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.event.DomainEvent;
import com.albatross.domain.event.EventType;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Result;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Stores each event record as UTF-8 JSON; the type name travels beside the payload.
 */
@Component
public class JacksonEventCodec implements EventCodec {

    private final ObjectMapper objectMapper;

    public JacksonEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Result<NewEvent, CoreError> encode(DomainEvent event) {
        try {
            byte[] payload = objectMapper.writeValueAsBytes(event);
            return Result.success(new NewEvent(event.eventType(), payload, event.tenantId()));
        } catch (JsonProcessingException e) {
            return Result.failure(new CoreError.Serialization("Failed to serialize " + event.eventType() + ": " + e.getOriginalMessage()));
        }
    }

    @Override
    public Result<DomainEvent, CoreError> decode(String eventType, byte[] payload) {
        Optional<EventType> type = EventType.fromName(eventType);
        if (type.isEmpty()) {
            return Result.failure(new CoreError.Deserialization("Unknown event type: " + eventType));
        }
        if (payload == null || payload.length == 0) {
            return Result.failure(new CoreError.Deserialization("Empty payload for " + eventType));
        }
        try {
            return Result.success(objectMapper.readValue(payload, type.get().eventClass()));
        } catch (IOException e) {
            return Result.failure(new CoreError.Deserialization("Failed to deserialize " + eventType + ": " + e.getMessage()));
        }
    }
}
