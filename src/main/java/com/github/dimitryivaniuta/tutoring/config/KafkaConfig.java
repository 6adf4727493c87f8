package com.github.dimitryivaniuta.tutoring.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Kafka configuration for the settlement-request channel.
 */
@Configuration
public class KafkaConfig {

    /**
     * Name of the batch listener container factory used by the settlement worker.
     */
    public static final String SETTLEMENT_LISTENER_FACTORY = "settlementBatchListenerFactory";

    /**
     * Creates the settlement topic for local/dev environments.
     *
     * <p>Only registered when a topic name is configured; in production the topic is provisioned outside the
     * application.</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.settlement", name = "topic")
    public NewTopic settlementRequestsTopic(AppProperties props) {
        return TopicBuilder.name(props.getSettlement().getTopic())
                .partitions(props.getSettlement().getPartitions())
                .replicas(1)
                .build();
    }

    /**
     * Listener container factory delivering records in batches, one worker invocation per poll.
     *
     * <p>A batch whose invocation throws is retried with backoff until it succeeds. Offsets are never committed
     * past it, so an outage of the secret store or the database proxy delays settlement instead of dropping
     * it.</p>
     *
     * @param configurer      Boot's factory configurer (applies {@code spring.kafka.listener.*})
     * @param consumerFactory consumer factory
     * @param props           application properties
     * @return batch listener factory
     */
    @Bean(SETTLEMENT_LISTENER_FACTORY)
    public ConcurrentKafkaListenerContainerFactory<Object, Object> settlementBatchListenerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            AppProperties props
    ) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);
        factory.setBatchListener(true);
        factory.setCommonErrorHandler(new DefaultErrorHandler(settlementRetryBackOff(props.getSettlement())));
        return factory;
    }

    static BackOff settlementRetryBackOff(AppProperties.Settlement settlement) {
        ExponentialBackOff backOff = new ExponentialBackOff(settlement.getRetryInitialInterval().toMillis(), 2.0);
        backOff.setMaxInterval(settlement.getRetryMaxInterval().toMillis());
        // no max elapsed time: the batch is retried until the worker succeeds
        backOff.setMaxElapsedTime(Long.MAX_VALUE);
        return backOff;
    }
}
