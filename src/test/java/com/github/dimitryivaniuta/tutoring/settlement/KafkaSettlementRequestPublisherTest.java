package com.github.dimitryivaniuta.tutoring.settlement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.error.ConfigurationException;
import com.github.dimitryivaniuta.tutoring.error.TransportException;
import com.github.dimitryivaniuta.tutoring.support.TestObjects;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaSettlementRequestPublisherTest {

    private final ObjectMapper objectMapper = TestObjects.objectMapper();

    private KafkaTemplate<String, String> kafkaTemplate;
    private AppProperties properties;
    private KafkaSettlementRequestPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = Mockito.mock(KafkaTemplate.class);
        properties = TestObjects.properties();
        publisher = new KafkaSettlementRequestPublisher(kafkaTemplate, properties, objectMapper);
    }

    @Test
    void sendsRequestKeyedByPaymentIdAndWaitsForAck() throws Exception {
        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(ok);

        publisher.publish(SettlementRequest.pending(42L, 7L, 150.0, "pix"));

        ArgumentCaptor<String> topic = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        Mockito.verify(kafkaTemplate).send(topic.capture(), key.capture(), payload.capture());

        Assertions.assertEquals("tutoring.settlement-requests", topic.getValue());
        Assertions.assertEquals("42", key.getValue());
        JsonNode json = objectMapper.readTree(payload.getValue());
        Assertions.assertEquals(42L, json.get("id_pagamento").asLong());
        Assertions.assertEquals(7L, json.get("id_conexao").asLong());
        Assertions.assertEquals(150.0, json.get("valor").asDouble(), 0.0001);
        Assertions.assertEquals("pix", json.get("forma_pagamento").asText());
        Assertions.assertEquals("Pending", json.get("status_pagamento").asText());
    }

    @Test
    void brokerFailureIsTransportError() {
        CompletableFuture<SendResult<String, String>> failed = CompletableFuture.failedFuture(
                new IllegalStateException("broker unavailable"));
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(failed);

        TransportException ex = Assertions.assertThrows(TransportException.class,
                () -> publisher.publish(SettlementRequest.pending(42L, 7L, 150.0, "pix")));
        Assertions.assertTrue(ex.getMessage().contains("broker unavailable"));
        Assertions.assertEquals("TRANSPORT_ERROR", ex.getCode());
    }

    @Test
    void missingAckWithinTimeoutIsTransportError() {
        properties.getSettlement().setSendTimeout(Duration.ofMillis(10));
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString()))
                .thenReturn(new CompletableFuture<>());

        Assertions.assertThrows(TransportException.class,
                () -> publisher.publish(SettlementRequest.pending(42L, 7L, 150.0, "pix")));
    }

    @Test
    void missingTopicIsConfigurationError() {
        properties.getSettlement().setTopic("");

        Assertions.assertThrows(ConfigurationException.class,
                () -> publisher.publish(SettlementRequest.pending(42L, 7L, 150.0, "pix")));
        Mockito.verifyNoInteractions(kafkaTemplate);
    }
}
