package com.github.dimitryivaniuta.tutoring.settlement;

import java.util.List;

/**
 * Messages delivered to one worker invocation.
 *
 * @param messages messages in delivery order, possibly empty
 */
public record SettlementBatch(List<QueuedMessage> messages) {

    public SettlementBatch {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
