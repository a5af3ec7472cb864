package com.albatross.adapter.out.messaging;

import com.albatross.application.port.in.ProjectEventUseCase;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Drains the tenant, user and pirep topics into the read models. Each record is tried once and
 * always acknowledged; a record that cannot be decoded or applied is dropped and counted.
 */
@Component
@ConditionalOnExpression("'${app.bus.type:kafka}' == 'kafka' and ${app.projection.enabled:true}")
public class ProjectionEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(ProjectionEventConsumer.class);

    private final ProjectEventUseCase projectEventUseCase;
    private final MetricsPort metrics;

    public ProjectionEventConsumer(ProjectEventUseCase projectEventUseCase, MetricsPort metrics) {
        this.projectEventUseCase = projectEventUseCase;
        this.metrics = metrics;
    }

    @KafkaListener(
        topics = "${app.bus.exchange:albatross}.tenant",
        groupId = "${app.projection.group-id:albatross-projection}",
        containerFactory = "manualAckContainerFactory")
    public void consumeTenantEvents(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consume(record, ack);
    }

    @KafkaListener(
        topics = "${app.bus.exchange:albatross}.user",
        groupId = "${app.projection.group-id:albatross-projection}",
        containerFactory = "manualAckContainerFactory")
    public void consumeUserEvents(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consume(record, ack);
    }

    @KafkaListener(
        topics = "${app.bus.exchange:albatross}.pirep",
        groupId = "${app.projection.group-id:albatross-projection}",
        containerFactory = "manualAckContainerFactory")
    public void consumePirepEvents(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consume(record, ack);
    }

    void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String eventType = extractHeader(record, KafkaEventPublisher.EVENT_TYPE_HEADER);
        String requestId = extractHeader(record, KafkaEventPublisher.REQUEST_ID_HEADER);

        if (requestId != null) {
            MDC.put("requestId", requestId);
        }

        try {
            log.debug("Received event: topic={}, type={}, key={}, offset={}",
                record.topic(), eventType, record.key(), record.offset());

            if (eventType == null) {
                log.warn("Dropping record without eventType header: topic={}, offset={}", record.topic(), record.offset());
                metrics.incrementProjectionsDropped();
                return;
            }

            String aggregateId = extractHeader(record, KafkaEventPublisher.AGGREGATE_ID_HEADER);
            Long sequence = parseSequence(extractHeader(record, KafkaEventPublisher.SEQUENCE_HEADER));
            byte[] payload = record.value() != null ? record.value().getBytes(StandardCharsets.UTF_8) : new byte[0];

            Result<ProjectEventUseCase.Outcome, CoreError> result = projectEventUseCase.project(
                eventType, aggregateId != null ? aggregateId : record.key(), sequence, payload);

            if (result.isFailure()) {
                log.error("Dropping event: type={}, key={}, error={}", eventType, record.key(), result.errorOrNull().message());
                metrics.incrementProjectionsDropped();
            }
        } catch (RuntimeException e) {
            log.error("Failed to process event: type={}, error={}", eventType, e.getMessage(), e);
            metrics.incrementProjectionsDropped();
        } finally {
            ack.acknowledge();
            MDC.remove("requestId");
        }
    }

    private Long parseSequence(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed sequence header: {}", value);
            return null;
        }
    }

    private String extractHeader(ConsumerRecord<String, String> record, String headerName) {
        Header header = record.headers().lastHeader(headerName);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
