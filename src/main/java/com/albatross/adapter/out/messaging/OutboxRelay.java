package com.albatross.adapter.out.messaging;

import com.albatross.application.port.out.EventPublishException;
import com.albatross.application.port.out.EventPublisher;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.OutboxRepository;
import com.albatross.domain.event.EventType;
import com.albatross.domain.model.StoredEvent;
import com.albatross.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Republishes events that were persisted but never confirmed by the bus, for example when the
 * process died between the append and the publish. Entries younger than the grace period are left
 * to the command path that wrote them.
 */
@Component
@ConditionalOnProperty(name = "app.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxRelay {

    private static final Logger log = LoggerFactory.getLogger(OutboxRelay.class);

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public OutboxRelay(
            OutboxRepository outboxRepository,
            EventPublisher eventPublisher,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}")
    @Transactional
    public void relayUnpublished() {
        Instant cutoff = Instant.now().minusMillis(appProperties.getOutbox().getGracePeriodMs());
        List<StoredEvent> entries = outboxRepository.findUnpublished(cutoff, appProperties.getOutbox().getBatchSize());

        if (entries.isEmpty()) {
            return;
        }

        log.debug("Relaying {} outbox entries", entries.size());

        Map<String, List<Long>> relayed = new LinkedHashMap<>();
        int count = 0;
        for (StoredEvent entry : entries) {
            Optional<EventType> type = EventType.fromName(entry.eventType());
            if (type.isEmpty()) {
                log.error("Outbox entry with unregistered type, marking as processed: aggregateId={}, sequence={}, type={}",
                    entry.aggregateId(), entry.sequence(), entry.eventType());
                relayed.computeIfAbsent(entry.aggregateId(), id -> new ArrayList<>()).add(entry.sequence());
                continue;
            }
            try {
                eventPublisher.publish(type.get().kind().routingKey(entry.aggregateId()), entry);
            } catch (EventPublishException e) {
                // Stop here so later events of the same aggregate are not delivered ahead of this one.
                log.warn("Outbox relay interrupted: aggregateId={}, sequence={}, error={}",
                    entry.aggregateId(), entry.sequence(), e.getMessage());
                break;
            }
            relayed.computeIfAbsent(entry.aggregateId(), id -> new ArrayList<>()).add(entry.sequence());
            count++;
        }

        relayed.forEach(outboxRepository::markPublished);

        if (count > 0) {
            metrics.incrementOutboxEventsRelayed(count);
            log.info("Relayed {} unpublished events", count);
        }
    }

    @Scheduled(cron = "0 0 * * * *") // Every hour
    @Transactional
    public void cleanupProcessedEntries() {
        Instant threshold = Instant.now().minus(24, ChronoUnit.HOURS);
        outboxRepository.deleteProcessedOlderThan(threshold);
        log.info("Cleaned up processed outbox entries older than 24 hours");
    }
}
