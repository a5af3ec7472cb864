package com.albatross.adapter.out.notification;

import com.albatross.application.port.out.Notification;
import com.albatross.application.port.out.NotificationSubscriber;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryNotificationBus")
class InMemoryNotificationBusTest {

    private ObjectMapper objectMapper;
    private InMemoryNotificationBus bus;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        bus = new InMemoryNotificationBus(objectMapper);
    }

    @Test
    @DisplayName("Should deliver the JSON envelope until the subscription is closed")
    void shouldDeliverEnvelope() throws Exception {
        // Given
        List<String> received = new ArrayList<>();
        NotificationSubscriber.Subscription subscription =
            bus.subscribe((channel, payload) -> received.add(channel + "|" + payload));
        Notification notification = new Notification(
            "ApiKeyRevoked", Instant.parse("2026-01-01T00:00:00Z"), Map.of("key_id", "key_1"), "t-1", "u-1", 4L);

        // When
        bus.publish("user:u-1:apikeys", notification);
        subscription.close();
        bus.publish("user:u-1:apikeys", notification);

        // Then
        assertEquals(1, received.size());
        String[] parts = received.get(0).split("\\|", 2);
        assertEquals("user:u-1:apikeys", parts[0]);
        JsonNode envelope = objectMapper.readTree(parts[1]);
        assertEquals("ApiKeyRevoked", envelope.get("event_type").asText());
        assertEquals("2026-01-01T00:00:00Z", envelope.get("ts").asText());
        assertEquals("key_1", envelope.get("data").get("key_id").asText());
        assertEquals("t-1", envelope.get("meta").get("tenant_id").asText());
        assertEquals(4L, envelope.get("meta").get("version").asLong());
    }

    @Test
    @DisplayName("Should write a null version when the sequence is unknown")
    void shouldWriteNullVersion() {
        // When
        var envelope = NotificationEnvelope.toJson(objectMapper,
            new Notification("TenantCreated", Instant.now(), Map.of(), "t-1", "t-1", null));

        // Then
        assertTrue(envelope.get("meta").get("version").isNull());
    }
}
