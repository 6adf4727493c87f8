package com.github.dimitryivaniuta.tutoring.settlement;

import com.github.dimitryivaniuta.tutoring.config.KafkaConfig;
import com.github.dimitryivaniuta.tutoring.web.InvocationIdFilter;
import java.util.List;
import java.util.UUID;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka adapter of the settlement worker: one poll is one worker invocation.
 *
 * <p>Failed messages are logged and acknowledged with the batch. Exceptions thrown by the worker itself
 * (credentials, connection) go to the container's error handler, which retries the whole batch with backoff
 * until it succeeds (see {@link KafkaConfig#settlementBatchListenerFactory}).</p>
 */
@Component
public class SettlementBatchListener {

    private static final Logger log = LoggerFactory.getLogger(SettlementBatchListener.class);

    private final SettlementWorker worker;

    public SettlementBatchListener(SettlementWorker worker) {
        this.worker = worker;
    }

    @KafkaListener(
            id = "settlement-worker",
            idIsGroup = false,
            topics = "${app.settlement.topic}",
            containerFactory = KafkaConfig.SETTLEMENT_LISTENER_FACTORY,
            autoStartup = "${app.settlement.listener-auto-startup:true}"
    )
    public void onBatch(List<ConsumerRecord<String, String>> records) {
        MDC.put(InvocationIdFilter.MDC_KEY, UUID.randomUUID().toString());
        try {
            SettlementBatchResult result = worker.process(toBatch(records));
            if (result.hasFailures()) {
                log.error("Settlement messages not applied and not redelivered. ids={}", result.failedMessageIds());
            }
        } finally {
            MDC.remove(InvocationIdFilter.MDC_KEY);
        }
    }

    static SettlementBatch toBatch(List<ConsumerRecord<String, String>> records) {
        return new SettlementBatch(records.stream()
                .map(r -> new QueuedMessage(messageId(r), r.value()))
                .toList());
    }

    static String messageId(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
