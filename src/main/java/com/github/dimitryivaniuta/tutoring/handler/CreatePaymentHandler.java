package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.handler.dto.CreatePaymentRequest;
import com.github.dimitryivaniuta.tutoring.handler.dto.PaymentCreatedResponse;
import com.github.dimitryivaniuta.tutoring.repo.PaymentRepository;
import com.github.dimitryivaniuta.tutoring.settlement.SettlementRequest;
import com.github.dimitryivaniuta.tutoring.settlement.SettlementRequestPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@code POST /api/payments}: first settlement stage.
 *
 * <p>Records the payment as {@code Pending}, commits, releases the connection and only then publishes the
 * settlement request. If publishing fails the row stays {@code Pending} and the caller gets a 500. Nothing
 * reconciles such rows.</p>
 */
@Component
public class CreatePaymentHandler extends RequestHandler {

    static final String CREATED_MESSAGE = "Payment recorded and sent for processing!";

    private static final Logger log = LoggerFactory.getLogger(CreatePaymentHandler.class);

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final PaymentRepository paymentRepository;
    private final SettlementRequestPublisher publisher;
    private final RequestBodyReader bodyReader;

    private final Counter registeredCounter;
    private final Counter insertCounter;

    /**
     * Creates the handler.
     *
     * @param credentialProvider secret store access
     * @param databaseGateway    connection factory
     * @param paymentRepository  payment statements
     * @param publisher          settlement channel
     * @param bodyReader         request decoding and validation
     * @param objectMapper       jackson mapper
     * @param properties         app properties
     * @param meterRegistry      metrics
     */
    public CreatePaymentHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            PaymentRepository paymentRepository,
            SettlementRequestPublisher publisher,
            RequestBodyReader bodyReader,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.paymentRepository = paymentRepository;
        this.publisher = publisher;
        this.bodyReader = bodyReader;

        this.registeredCounter = Counter.builder("tutoring.payments.registered").register(meterRegistry);
        this.insertCounter = Counter.builder("tutoring.db.inserts").tag("table", "payments").register(meterRegistry);
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        CreatePaymentRequest body = bodyReader.read(request, CreatePaymentRequest.class);
        String paymentMethod = body.paymentMethod().trim();

        long paymentId;
        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            paymentId = paymentRepository.insertPending(session, body.engagementId(), body.amount(), paymentMethod);
            session.commit();
        }
        insertCounter.increment();

        SettlementRequest settlement = SettlementRequest.pending(
                paymentId, body.engagementId(), body.amount().doubleValue(), paymentMethod);
        try {
            publisher.publish(settlement);
        } catch (RuntimeException e) {
            log.error("Payment committed but settlement request not published; row stays Pending. id_pagamento={}",
                    paymentId);
            throw e;
        }
        registeredCounter.increment();

        log.info("Payment recorded. id_pagamento={} id_conexao={}", paymentId, body.engagementId());
        return respond(201, new PaymentCreatedResponse(CREATED_MESSAGE, paymentId));
    }

    @Override
    protected String allowedMethods() {
        return "OPTIONS, GET, POST";
    }
}
