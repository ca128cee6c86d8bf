package com.rms.authsync.jetstream.consumer;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.authsync.jetstream.config.ConsumerProperties;
import com.rms.authsync.jetstream.config.ConsumerProperties.StreamBinding;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.ConsumerInfo;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;

/**
 * Makes sure each configured binding has a durable pull consumer on the server and a bound
 * subscription in this process.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>An existing durable is used as-is; its server-side configuration is never overwritten.</li>
 *   <li>A missing durable is created with explicit ack and deliver-all, so a fresh consumer replays
 *       the whole backlog once.</li>
 *   <li>Subscriptions are cached per stream/durable; {@link #ensure(StreamBinding)} is cheap after the
 *       first call and is invoked on every sweep.</li>
 *   <li>{@link #invalidate(StreamBinding)} drops a cached subscription after a stream-level failure so
 *       the next sweep binds again.</li>
 * </ul>
 */
@Component
public class DurableConsumerBinder {

    private static final Logger log = LoggerFactory.getLogger(DurableConsumerBinder.class);

    /** JetStream API error code for "consumer not found". */
    static final int JS_CONSUMER_NOT_FOUND_ERR = 10014;

    /** JetStream API error code for "stream not found". */
    static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStream js;
    private final JetStreamManagement jsm;
    private final ConsumerProperties props;

    private final Map<String, JetStreamSubscription> subscriptions = new ConcurrentHashMap<>();

    public DurableConsumerBinder(JetStream js, JetStreamManagement jsm, ConsumerProperties props) {
        this.js = js;
        this.jsm = jsm;
        this.props = props;
    }

    public JetStreamSubscription ensure(StreamBinding binding) throws IOException, JetStreamApiException {
        JetStreamSubscription cached = subscriptions.get(key(binding));
        if (cached != null && cached.isActive()) {
            return cached;
        }

        ensureConsumer(binding);

        JetStreamSubscription sub = js.subscribe(
                binding.getFilterSubject(),
                PullSubscribeOptions.bind(binding.getName(), binding.getDurable()));
        subscriptions.put(key(binding), sub);

        log.info("Bound pull subscription stream={} durable={} filter={}",
                binding.getName(), binding.getDurable(), binding.getFilterSubject());
        return sub;
    }

    /**
     * Looks the durable up and creates it when the server reports it missing.
     */
    ConsumerInfo ensureConsumer(StreamBinding binding) throws IOException, JetStreamApiException {
        try {
            return jsm.getConsumerInfo(binding.getName(), binding.getDurable());
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                log.warn("Stream does not exist yet stream={} durable={}", binding.getName(), binding.getDurable());
                throw e;
            }
            if (e.getApiErrorCode() != JS_CONSUMER_NOT_FOUND_ERR) {
                throw e;
            }
        }

        ConsumerInfo created = jsm.addOrUpdateConsumer(binding.getName(), consumerConfiguration(binding));
        log.info("Created durable consumer stream={} durable={} filter={} maxDeliver={} ackWait={}",
                binding.getName(), binding.getDurable(), binding.getFilterSubject(),
                props.getMaxDeliver(), props.getAckWait());
        return created;
    }

    ConsumerConfiguration consumerConfiguration(StreamBinding binding) {
        return ConsumerConfiguration.builder()
                .durable(binding.getDurable())
                .ackPolicy(AckPolicy.Explicit)
                .deliverPolicy(DeliverPolicy.All)
                .replayPolicy(ReplayPolicy.Instant)
                .filterSubject(binding.getFilterSubject())
                .maxAckPending(props.getMaxAckPending())
                .maxDeliver(props.getMaxDeliver())
                .ackWait(props.getAckWait())
                .maxPullWaiting(props.getMaxPullWaiting())
                .build();
    }

    public void invalidate(StreamBinding binding) {
        JetStreamSubscription sub = subscriptions.remove(key(binding));
        if (sub == null) {
            return;
        }
        try {
            sub.unsubscribe();
        } catch (IllegalStateException e) {
            log.debug("Unsubscribe of stale subscription failed stream={} err={}", binding.getName(), e.toString());
        }
    }

    /**
     * Releases every cached subscription. The durable consumers stay on the server.
     */
    public void releaseAll() {
        subscriptions.forEach((key, sub) -> {
            try {
                sub.unsubscribe();
            } catch (IllegalStateException e) {
                log.debug("Unsubscribe on shutdown failed key={} err={}", key, e.toString());
            }
        });
        subscriptions.clear();
    }

    private static String key(StreamBinding binding) {
        return binding.getName() + "/" + binding.getDurable();
    }
}
