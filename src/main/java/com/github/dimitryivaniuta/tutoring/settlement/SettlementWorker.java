package com.github.dimitryivaniuta.tutoring.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.PaymentStatus;
import com.github.dimitryivaniuta.tutoring.error.NotFoundException;
import com.github.dimitryivaniuta.tutoring.error.StorageException;
import com.github.dimitryivaniuta.tutoring.error.ValidationException;
import com.github.dimitryivaniuta.tutoring.repo.PaymentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Second settlement stage: resolves pending payments delivered by the settlement channel.
 *
 * <p>Design points:
 * <ul>
 *   <li>An empty batch touches neither the secret store nor the database.</li>
 *   <li>One credential fetch and one connection per non-empty batch.</li>
 *   <li>Each message is committed on its own; a failing message is rolled back, reported in the result and
 *       does not affect the others.</li>
 *   <li>The status update is unconditional, so a redelivered message re-applies its outcome.</li>
 * </ul>
 *
 * <p>Failures to obtain credentials or a connection are not per-message and propagate to the caller.</p>
 */
@Component
public class SettlementWorker {

    /**
     * MDC key carrying the id of the message being settled.
     */
    public static final String MDC_MESSAGE_ID = "messageId";

    private static final Logger log = LoggerFactory.getLogger(SettlementWorker.class);

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final PaymentRepository paymentRepository;
    private final SettlementDecider decider;
    private final ObjectMapper objectMapper;

    private final Counter updateCounter;
    private final Map<PaymentStatus, Counter> outcomeCounters = new EnumMap<>(PaymentStatus.class);

    /**
     * Creates the worker.
     *
     * @param credentialProvider secret store access
     * @param databaseGateway    connection factory
     * @param paymentRepository  payment statements
     * @param decider            outcome decision
     * @param objectMapper       jackson mapper
     * @param meterRegistry      metrics
     */
    public SettlementWorker(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            PaymentRepository paymentRepository,
            SettlementDecider decider,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.paymentRepository = paymentRepository;
        this.decider = decider;
        this.objectMapper = objectMapper;

        this.updateCounter = Counter.builder("settlement.updates.executed").register(meterRegistry);
        for (PaymentStatus status : PaymentStatus.values()) {
            if (status.isTerminal()) {
                outcomeCounters.put(status, Counter.builder("settlement.outcomes")
                        .tag("status", status.label())
                        .register(meterRegistry));
            }
        }
    }

    /**
     * Settles every message of the batch.
     *
     * @param batch delivered messages
     * @return counts and the ids of failed messages
     */
    public SettlementBatchResult process(SettlementBatch batch) {
        List<QueuedMessage> messages = batch.messages();
        if (messages.isEmpty()) {
            log.debug("Empty settlement batch, nothing to do");
            return SettlementBatchResult.empty();
        }

        int settled = 0;
        List<String> failed = new ArrayList<>();

        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            for (QueuedMessage message : messages) {
                MDC.put(MDC_MESSAGE_ID, message.messageId());
                try {
                    PaymentStatus outcome = settle(session, message);
                    session.commit();
                    updateCounter.increment();
                    outcomeCounters.get(outcome).increment();
                    settled++;
                } catch (RuntimeException e) {
                    failed.add(message.messageId());
                    log.warn("Settlement message failed. error={}", safeError(e));
                    rollback(session);
                } finally {
                    MDC.remove(MDC_MESSAGE_ID);
                }
            }
        }

        if (failed.isEmpty()) {
            log.info("Settlement batch done. received={} settled={}", messages.size(), settled);
        } else {
            log.warn("Settlement batch done with failures. received={} settled={} failed={}",
                    messages.size(), settled, failed);
        }
        return new SettlementBatchResult(messages.size(), settled, failed);
    }

    private PaymentStatus settle(DatabaseSession session, QueuedMessage message) {
        SettlementRequest request = parse(message.body());
        long paymentId = request.paymentId();

        PaymentStatus outcome = decider.decide(request);
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalStateException("Settlement decision must be terminal, was " + outcome);
        }

        int rows = paymentRepository.updateStatus(session, paymentId, outcome);
        if (rows == 0) {
            throw new NotFoundException("Payment " + paymentId + " not found");
        }
        log.info("Payment settled. id_pagamento={} status={}", paymentId, outcome.label());
        return outcome;
    }

    private SettlementRequest parse(String body) {
        if (!StringUtils.hasText(body)) {
            throw new ValidationException("Settlement message body is empty");
        }
        SettlementRequest request;
        try {
            request = objectMapper.readValue(body, SettlementRequest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Settlement message is not a valid request: " + e.getOriginalMessage(), e);
        }
        if (request == null || request.paymentId() == null || request.paymentId() <= 0) {
            throw new ValidationException("Settlement message has no valid 'id_pagamento'");
        }
        return request;
    }

    private void rollback(DatabaseSession session) {
        try {
            session.rollback();
        } catch (StorageException e) {
            log.warn("Rollback after failed settlement message failed. error={}", e.getMessage());
        }
    }

    private String safeError(Exception ex) {
        String msg = ex.getMessage();
        return msg != null ? msg : ex.getClass().getSimpleName();
    }
}
