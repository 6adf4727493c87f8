package com.github.dimitryivaniuta.tutoring.settlement;

import java.util.List;

/**
 * Outcome of one worker invocation.
 *
 * @param received         messages in the batch
 * @param settled          messages whose payment row was updated and committed
 * @param failedMessageIds ids of the messages that were not applied
 */
public record SettlementBatchResult(int received, int settled, List<String> failedMessageIds) {

    public SettlementBatchResult {
        failedMessageIds = List.copyOf(failedMessageIds);
    }

    public static SettlementBatchResult empty() {
        return new SettlementBatchResult(0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failedMessageIds.isEmpty();
    }
}
