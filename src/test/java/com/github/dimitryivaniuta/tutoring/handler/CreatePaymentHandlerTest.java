package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.error.TransportException;
import com.github.dimitryivaniuta.tutoring.repo.PaymentRepository;
import com.github.dimitryivaniuta.tutoring.settlement.SettlementRequest;
import com.github.dimitryivaniuta.tutoring.settlement.SettlementRequestPublisher;
import com.github.dimitryivaniuta.tutoring.support.H2Database;
import com.github.dimitryivaniuta.tutoring.support.TestObjects;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;

class CreatePaymentHandlerTest {

    private static final String VALID_BODY = "{\"id_conexao\":7,\"valor\":150.00,\"forma_pagamento\":\"pix\"}";

    private final ObjectMapper objectMapper = TestObjects.objectMapper();

    private CredentialProvider credentialProvider;
    private DatabaseGateway gateway;
    private DatabaseSession session;
    private PaymentRepository repository;
    private SettlementRequestPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private CreatePaymentHandler handler;

    @BeforeEach
    void setUp() {
        credentialProvider = Mockito.mock(CredentialProvider.class);
        gateway = Mockito.mock(DatabaseGateway.class);
        session = Mockito.mock(DatabaseSession.class);
        repository = Mockito.mock(PaymentRepository.class);
        publisher = Mockito.mock(SettlementRequestPublisher.class);
        meterRegistry = new SimpleMeterRegistry();

        Mockito.when(credentialProvider.fetch()).thenReturn(H2Database.CREDENTIALS);
        Mockito.when(gateway.open(H2Database.CREDENTIALS)).thenReturn(session);

        handler = new CreatePaymentHandler(credentialProvider, gateway, repository, publisher,
                TestObjects.bodyReader(), objectMapper, TestObjects.properties(), meterRegistry);
    }

    @Test
    void publishesOnlyAfterCommitAndRelease() throws Exception {
        Mockito.when(repository.insertPending(Mockito.eq(session), Mockito.eq(7L), amountOf("150"), Mockito.eq("pix")))
                .thenReturn(42L);

        ApiResponse response = handler.handle(ApiRequest.withBody("POST", VALID_BODY));

        Assertions.assertEquals(201, response.statusCode());
        JsonNode body = objectMapper.readTree(response.body());
        Assertions.assertEquals(42L, body.get("id_pagamento").asLong());
        Assertions.assertEquals("Payment recorded and sent for processing!", body.get("message").asText());

        InOrder order = Mockito.inOrder(repository, session, publisher);
        order.verify(repository).insertPending(Mockito.eq(session), Mockito.eq(7L), amountOf("150"), Mockito.eq("pix"));
        order.verify(session).commit();
        order.verify(session).close();
        order.verify(publisher).publish(Mockito.any(SettlementRequest.class));
    }

    @Test
    void publishedMessageDescribesThePendingPayment() {
        Mockito.when(repository.insertPending(Mockito.eq(session), Mockito.eq(7L), Mockito.any(), Mockito.eq("pix")))
                .thenReturn(42L);

        handler.handle(ApiRequest.withBody("POST", VALID_BODY));

        ArgumentCaptor<SettlementRequest> captor = ArgumentCaptor.forClass(SettlementRequest.class);
        Mockito.verify(publisher).publish(captor.capture());
        SettlementRequest message = captor.getValue();
        Assertions.assertEquals(42L, message.paymentId());
        Assertions.assertEquals(7L, message.engagementId());
        Assertions.assertEquals(150.0, message.amount(), 0.0001);
        Assertions.assertEquals("pix", message.paymentMethod());
        Assertions.assertEquals("Pending", message.status());

        Assertions.assertEquals(1.0, meterRegistry.counter("tutoring.payments.registered").count());
        Assertions.assertEquals(1.0, meterRegistry.counter("tutoring.db.inserts", "table", "payments").count());
    }

    @Test
    void publishFailureAfterCommitIsTransportError() throws Exception {
        Mockito.when(repository.insertPending(Mockito.eq(session), Mockito.eq(7L), Mockito.any(), Mockito.eq("pix")))
                .thenReturn(42L);
        Mockito.doThrow(new TransportException("No ack", new RuntimeException("broker down")))
                .when(publisher).publish(Mockito.any());

        ApiResponse response = handler.handle(ApiRequest.withBody("POST", VALID_BODY));

        Assertions.assertEquals(500, response.statusCode());
        Assertions.assertEquals("TRANSPORT_ERROR", objectMapper.readTree(response.body()).get("code").asText());
        Mockito.verify(session).commit();
        Assertions.assertEquals(0.0, meterRegistry.counter("tutoring.payments.registered").count());
    }

    @Test
    void invalidBodyTouchesNeitherDatabaseNorChannel() {
        ApiResponse response = handler.handle(
                ApiRequest.withBody("POST", "{\"id_conexao\":7,\"forma_pagamento\":\"pix\"}"));

        Assertions.assertEquals(400, response.statusCode());
        Mockito.verifyNoInteractions(credentialProvider, gateway, repository, publisher);
    }

    @Test
    void unknownEngagementIsStorageErrorAndNothingIsPublished() {
        Mockito.when(repository.insertPending(Mockito.eq(session), Mockito.eq(7L), Mockito.any(), Mockito.eq("pix")))
                .thenThrow(new DataIntegrityViolationException("fk_pagamentos_conexao"));

        ApiResponse response = handler.handle(ApiRequest.withBody("POST", VALID_BODY));

        Assertions.assertEquals(500, response.statusCode());
        Mockito.verify(session, Mockito.never()).commit();
        Mockito.verify(session).close();
        Mockito.verifyNoInteractions(publisher);
    }

    private static BigDecimal amountOf(String value) {
        return Mockito.argThat(v -> v != null && v.compareTo(new BigDecimal(value)) == 0);
    }
}
