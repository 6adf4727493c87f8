package com.github.dimitryivaniuta.tutoring.settlement;

/**
 * One message of a settlement batch.
 *
 * @param messageId transport-level id, used only for failure reporting
 * @param body      raw JSON body
 */
public record QueuedMessage(String messageId, String body) {}
