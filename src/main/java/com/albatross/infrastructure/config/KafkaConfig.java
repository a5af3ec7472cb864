package com.albatross.infrastructure.config;

import com.albatross.domain.model.AggregateKind;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import java.util.Arrays;

@Configuration
@ConditionalOnProperty(name = "app.bus.type", havingValue = "kafka", matchIfMissing = true)
public class KafkaConfig {

    /**
     * One durable topic per aggregate entity, {@code <exchange>.<entity>}.
     */
    @Bean
    public KafkaAdmin.NewTopics aggregateTopics(AppProperties appProperties) {
        AppProperties.Bus bus = appProperties.getBus();
        NewTopic[] topics = Arrays.stream(AggregateKind.values())
            .map(kind -> TopicBuilder.name(bus.getExchange() + "." + kind.entity())
                .partitions(bus.getPartitions())
                .replicas(bus.getReplicas())
                .build())
            .toArray(NewTopic[]::new);
        return new KafkaAdmin.NewTopics(topics);
    }

    /**
     * Listeners acknowledge each record themselves; nothing is retried by the container.
     */
    @Bean(name = "manualAckContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, String> manualAckContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> genericFactory =
                new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(genericFactory, consumerFactory);
        genericFactory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(new FixedBackOff(0L, 0L));
        errorHandler.setCommitRecovered(true);
        genericFactory.setCommonErrorHandler(errorHandler);
        @SuppressWarnings("unchecked")
        ConcurrentKafkaListenerContainerFactory<String, String> typedFactory =
                (ConcurrentKafkaListenerContainerFactory<String, String>) (ConcurrentKafkaListenerContainerFactory<?, ?>) genericFactory;
        return typedFactory;
    }
}
