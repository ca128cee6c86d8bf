package com.rms.authsync.consumer;

import java.time.Duration;

/**
 * What the processing pipeline needs from a broker message.
 *
 * <p>Implementations may throw from {@link #ack()} and {@link #nak(Duration)} (e.g. the message did
 * not come from a JetStream consumer); the pipeline logs such failures and moves on.</p>
 */
public interface InboundMessage {

    byte[] body();

    /**
     * @return how many times the broker has delivered this message, 1 for the first delivery,
     *         0 when the broker does not report it
     */
    long deliveryCount();

    void ack();

    /**
     * Negative acknowledgement. A zero or null delay asks for immediate redelivery.
     */
    void nak(Duration delay);
}
