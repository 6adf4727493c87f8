package com.github.dimitryivaniuta.tutoring.settlement;

/**
 * Producer side of the settlement channel.
 */
public interface SettlementRequestPublisher {

    /**
     * Publishes a settlement request and waits until the channel accepted it.
     *
     * @param request request to publish
     * @throws com.github.dimitryivaniuta.tutoring.error.TransportException if the channel did not accept it
     */
    void publish(SettlementRequest request);
}
