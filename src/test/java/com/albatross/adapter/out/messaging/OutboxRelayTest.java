package com.albatross.adapter.out.messaging;

import com.albatross.application.port.out.EventPublishException;
import com.albatross.application.port.out.EventPublisher;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.OutboxRepository;
import com.albatross.domain.model.StoredEvent;
import com.albatross.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxRelay")
class OutboxRelayTest {

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private EventPublisher eventPublisher;

    @Mock
    private MetricsPort metrics;

    private OutboxRelay relay;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getOutbox().setBatchSize(50);
        relay = new OutboxRelay(outboxRepository, eventPublisher, appProperties, metrics);
    }

    private static StoredEvent stored(String aggregateId, long sequence, String type) {
        return new StoredEvent(aggregateId, sequence, type, "{}".getBytes());
    }

    @Nested
    @DisplayName("relayUnpublished")
    class RelayTests {

        @Test
        @DisplayName("Should do nothing when nothing is pending")
        void shouldSkipWhenEmpty() {
            // Given
            when(outboxRepository.findUnpublished(any(Instant.class), eq(50))).thenReturn(List.of());

            // When
            relay.relayUnpublished();

            // Then
            verifyNoInteractions(eventPublisher);
            verify(outboxRepository, never()).markPublished(any(), any());
        }

        @Test
        @DisplayName("Should publish under the aggregate routing key and mark entries")
        void shouldRelayAndMark() {
            // Given
            StoredEvent first = stored("u-1", 1, "UserRegistered");
            StoredEvent second = stored("t-1", 1, "TenantCreated");
            when(outboxRepository.findUnpublished(any(Instant.class), eq(50))).thenReturn(List.of(first, second));

            // When
            relay.relayUnpublished();

            // Then
            verify(eventPublisher).publish("user.u-1", first);
            verify(eventPublisher).publish("tenant.t-1", second);
            verify(outboxRepository).markPublished("u-1", List.of(1L));
            verify(outboxRepository).markPublished("t-1", List.of(1L));
            verify(metrics).incrementOutboxEventsRelayed(2);
        }

        @Test
        @DisplayName("Should stop at the first publish failure")
        void shouldStopOnFailure() {
            // Given
            StoredEvent first = stored("u-1", 1, "UserRegistered");
            StoredEvent second = stored("u-1", 2, "PasswordChanged");
            StoredEvent third = stored("u-1", 3, "UserLoggedIn");
            when(outboxRepository.findUnpublished(any(Instant.class), eq(50))).thenReturn(List.of(first, second, third));
            doNothing().when(eventPublisher).publish("user.u-1", first);
            doThrow(new EventPublishException("down", null)).when(eventPublisher).publish("user.u-1", second);

            // When
            relay.relayUnpublished();

            // Then
            verify(eventPublisher, never()).publish("user.u-1", third);
            verify(outboxRepository).markPublished("u-1", List.of(1L));
            verify(metrics).incrementOutboxEventsRelayed(1);
        }

        @Test
        @DisplayName("Should mark entries with an unknown type as processed without publishing")
        void shouldSkipUnknownType() {
            // Given
            StoredEvent unknown = stored("u-1", 1, "FleetGrounded");
            when(outboxRepository.findUnpublished(any(Instant.class), eq(50))).thenReturn(List.of(unknown));

            // When
            relay.relayUnpublished();

            // Then
            verifyNoInteractions(eventPublisher);
            verify(outboxRepository).markPublished("u-1", List.of(1L));
            verify(metrics, never()).incrementOutboxEventsRelayed(anyInt());
        }
    }

    @Test
    @DisplayName("Should delete processed entries older than a day")
    void shouldCleanup() {
        // When
        relay.cleanupProcessedEntries();

        // Then
        verify(outboxRepository).deleteProcessedOlderThan(any(Instant.class));
    }
}
