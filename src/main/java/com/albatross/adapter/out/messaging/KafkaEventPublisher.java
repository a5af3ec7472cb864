package com.albatross.adapter.out.messaging;

import com.albatross.application.port.out.EventPublishException;
import com.albatross.application.port.out.EventPublisher;
import com.albatross.domain.model.StoredEvent;
import com.albatross.infrastructure.config.AppProperties;
import com.albatross.infrastructure.context.RequestContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps routing key {@code <entity>.<id>} to topic {@code <exchange>.<entity>} with record key {@code <id>},
 * so one aggregate always lands on one partition. Waits for the broker acknowledgement before returning.
 */
@Component
@ConditionalOnProperty(name = "app.bus.type", havingValue = "kafka", matchIfMissing = true)
public class KafkaEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    public static final String EVENT_TYPE_HEADER = "eventType";
    public static final String ROUTING_KEY_HEADER = "routingKey";
    public static final String AGGREGATE_ID_HEADER = "aggregateId";
    public static final String SEQUENCE_HEADER = "sequence";
    public static final String REQUEST_ID_HEADER = "requestId";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties appProperties;

    public KafkaEventPublisher(KafkaTemplate<String, String> kafkaTemplate, AppProperties appProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.appProperties = appProperties;
    }

    @Override
    public void publish(String routingKey, StoredEvent event) {
        String topic = topicFor(routingKey);
        ProducerRecord<String, String> record = new ProducerRecord<>(
            topic,
            null,
            event.aggregateId(),
            new String(event.payload(), StandardCharsets.UTF_8)
        );

        record.headers().add(header(EVENT_TYPE_HEADER, event.eventType()));
        record.headers().add(header(ROUTING_KEY_HEADER, routingKey));
        record.headers().add(header(AGGREGATE_ID_HEADER, event.aggregateId()));
        record.headers().add(header(SEQUENCE_HEADER, Long.toString(event.sequence())));
        String requestId = RequestContext.getRequestId();
        if (requestId != null) {
            record.headers().add(header(REQUEST_ID_HEADER, requestId));
        }

        try {
            kafkaTemplate.send(record).get(appProperties.getBus().getPublishTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing " + event.eventType() + " to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new EventPublishException("Broker did not confirm " + event.eventType() + " on " + topic, e);
        } catch (org.springframework.kafka.KafkaException | org.apache.kafka.common.KafkaException e) {
            throw new EventPublishException("Failed to send " + event.eventType() + " to " + topic, e);
        }
        log.debug("Published event: type={}, topic={}, aggregateId={}, sequence={}",
            event.eventType(), topic, event.aggregateId(), event.sequence());
    }

    String topicFor(String routingKey) {
        int separator = routingKey.indexOf('.');
        if (separator <= 0) {
            throw new IllegalArgumentException("Routing key must look like <entity>.<id>: " + routingKey);
        }
        return appProperties.getBus().getExchange() + "." + routingKey.substring(0, separator);
    }

    private static RecordHeader header(String name, String value) {
        return new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8));
    }
}
