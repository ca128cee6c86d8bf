package com.rms.authsync.jetstream.consumer;

import java.time.Duration;

import io.nats.client.Message;

import com.rms.authsync.consumer.InboundMessage;

/**
 * {@link InboundMessage} over a jnats {@link Message} pulled from a JetStream consumer.
 */
public class NatsInboundMessage implements InboundMessage {

    private final Message message;

    public NatsInboundMessage(Message message) {
        this.message = message;
    }

    @Override
    public byte[] body() {
        return message.getData();
    }

    @Override
    public long deliveryCount() {
        if (!message.isJetStream()) {
            return 0;
        }
        return message.metaData().deliveredCount();
    }

    @Override
    public void ack() {
        message.ack();
    }

    @Override
    public void nak(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            message.nak();
        } else {
            message.nakWithDelay(delay);
        }
    }
}
