package com.github.dimitryivaniuta.tutoring.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.error.ConfigurationException;
import com.github.dimitryivaniuta.tutoring.error.TransportException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Publishes settlement requests to the configured Kafka topic, keyed by payment id.
 *
 * <p>Waits for the broker ack, bounded by {@code app.settlement.send-timeout}.</p>
 */
@Component
public class KafkaSettlementRequestPublisher implements SettlementRequestPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaSettlementRequestPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Creates the publisher.
     *
     * @param kafkaTemplate template
     * @param properties    app properties
     * @param objectMapper  jackson mapper
     */
    public KafkaSettlementRequestPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            ObjectMapper objectMapper
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(SettlementRequest request) {
        AppProperties.Settlement settlement = properties.getSettlement();
        String topic = settlement.getTopic();
        if (!StringUtils.hasText(topic)) {
            throw new ConfigurationException("Missing required configuration 'app.settlement.topic'");
        }

        String key = String.valueOf(request.paymentId());
        String payload = toJson(request);
        try {
            kafkaTemplate.send(topic, key, payload)
                    .get(settlement.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while publishing settlement request", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException("Settlement request was not accepted by " + topic + ": " + cause.getMessage(), e);
        } catch (TimeoutException e) {
            throw new TransportException("No ack from " + topic + " within " + settlement.getSendTimeout(), e);
        }
        log.debug("Settlement request published. topic={} key={}", topic, key);
    }

    private String toJson(SettlementRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize settlement request", e);
        }
    }
}
