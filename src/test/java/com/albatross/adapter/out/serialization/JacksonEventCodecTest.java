package com.albatross.adapter.out.serialization;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.event.DomainEvent;
import com.albatross.domain.event.PirepEvent;
import com.albatross.domain.event.UserEvent;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Role;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JacksonEventCodec")
class JacksonEventCodecTest {

    private JacksonEventCodec codec;

    @BeforeEach
    void setUp() {
        codec = new JacksonEventCodec(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    @DisplayName("Should encode with the registered type name and tenant")
    void shouldEncodeWithTypeName() {
        // Given
        UserEvent.Registered registered = new UserEvent.Registered(
            "u-1", "maverick", "mav@example.com", "hash", Role.PILOT, "t-1", Instant.parse("2026-01-01T00:00:00Z"));

        // When
        NewEvent encoded = codec.encode(registered).getOrThrow();

        // Then
        assertEquals("UserRegistered", encoded.eventType());
        assertEquals("t-1", encoded.tenantId());
    }

    @Test
    @DisplayName("Should decode what it encoded")
    void shouldDecodeEncoded() {
        // Given
        PirepEvent.Submitted submitted = new PirepEvent.Submitted(
            "p-1", "t-1", "u-1", "N1", "KJFK", "EGLL", "BA178", 6.5, null, Instant.parse("2026-01-01T00:00:00Z"));
        NewEvent encoded = codec.encode(submitted).getOrThrow();

        // When
        DomainEvent decoded = codec.decode(encoded.eventType(), encoded.payload()).getOrThrow();

        // Then
        assertEquals(submitted, decoded);
    }

    @Test
    @DisplayName("Should fail on an unknown type")
    void shouldFailOnUnknownType() {
        var result = codec.decode("FleetGrounded", "{}".getBytes(StandardCharsets.UTF_8));
        assertInstanceOf(CoreError.Deserialization.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should fail on an empty or malformed payload")
    void shouldFailOnBadPayload() {
        assertInstanceOf(CoreError.Deserialization.class, codec.decode("TenantCreated", new byte[0]).errorOrNull());
        assertInstanceOf(CoreError.Deserialization.class,
            codec.decode("TenantCreated", "not json".getBytes(StandardCharsets.UTF_8)).errorOrNull());
    }
}
