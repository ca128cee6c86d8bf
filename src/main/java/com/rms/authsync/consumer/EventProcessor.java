package com.rms.authsync.consumer;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.rms.authsync.core.codec.EventEnvelopeCodec;
import com.rms.authsync.core.error.DependencyNotReadyException;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.error.UnparseableEventException;
import com.rms.authsync.core.error.UnroutableEventException;
import com.rms.authsync.core.model.Admission;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.InboxRecord;
import com.rms.authsync.jetstream.config.ConsumerProperties;
import com.rms.authsync.jetstream.config.ConsumerProperties.StreamBinding;
import com.rms.authsync.r2dbc.service.InboxGate;
import com.rms.authsync.replication.EventRouter;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Runs one pulled message through decode, inbox admission, routing and the handler, then settles
 * it on the broker.
 *
 * <h2>Settlement</h2>
 * <ul>
 *   <li><b>ack</b>: applied, already applied, undecodable, unroutable, parked.</li>
 *   <li><b>nak</b> (with the configured delay): any other failure. The inbox transaction is rolled
 *       back first and the error is then recorded in {@code last_error} on its own.</li>
 * </ul>
 *
 * <p>The returned {@link Mono} never errors; failures are reflected in the {@link Disposition}.</p>
 */
@Component
public class EventProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    private static final int RAW_PREVIEW_CHARS = 200;

    private final EventEnvelopeCodec codec;
    private final EventRouter router;
    private final InboxGate gate;
    private final TransactionalOperator tx;
    private final ConsumerProperties props;

    public EventProcessor(EventEnvelopeCodec codec, EventRouter router, InboxGate gate, TransactionalOperator tx,
                          ConsumerProperties props) {
        this.codec = codec;
        this.router = router;
        this.gate = gate;
        this.tx = tx;
        this.props = props;
    }

    public Mono<Disposition> process(InboundMessage message, StreamBinding binding) {
        return Mono.defer(() -> {
            EventEnvelope event;
            try {
                event = codec.decode(message.body());
            } catch (UnparseableEventException e) {
                log.warn("Discarding undecodable message stream={} reason={} raw_preview={}",
                        binding.getName(), e.getMessage(), preview(message.body()));
                ack(message, binding, null);
                return Mono.just(Disposition.DISCARDED);
            }

            InboxRecord record = InboxRecord.seen(event, binding.getName(), binding.getDurable(), codec.encode(event));

            long deliveries = message.deliveryCount();
            if (deliveries >= props.getMaxDeliver()) {
                String reason = "Parked after " + deliveries + " deliveries (poison message or failing handler)";
                log.error("Parking event event_id={} subject={} stream={} deliveries={}",
                        event.id(), event.subject(), binding.getName(), deliveries);
                return park(message, binding, record, reason);
            }

            ReplicationHandler handler;
            try {
                handler = router.resolve(event.subject());
            } catch (UnroutableEventException e) {
                log.warn("Discarding event without handler event_id={} subject={} stream={}",
                        event.id(), event.subject(), binding.getName());
                ack(message, binding, event.id());
                return Mono.just(Disposition.UNROUTABLE);
            }

            return apply(event, record, handler)
                    .doOnNext(disposition -> {
                        ack(message, binding, event.id());
                        log.debug("Settled event_id={} subject={} disposition={}", event.id(), event.subject(), disposition);
                    })
                    .onErrorResume(err -> onFailure(message, binding, event, record, err));
        });
    }

    /**
     * Admission, handler and {@code markDone} in one transaction holding the inbox row lock.
     */
    private Mono<Disposition> apply(EventEnvelope event, InboxRecord record, ReplicationHandler handler) {
        return gate.admit(record)
                .flatMap(admission -> {
                    if (admission == Admission.ALREADY_DONE) {
                        return Mono.just(Disposition.DUPLICATE);
                    }
                    return Mono.defer(() -> handler.apply(event))
                            .timeout(props.getHandlerTimeout())
                            .then(gate.markDone(event.id()))
                            .thenReturn(Disposition.APPLIED);
                })
                .as(tx::transactional);
    }

    private Mono<Disposition> onFailure(InboundMessage message, StreamBinding binding, EventEnvelope event,
                                        InboxRecord record, Throwable err) {
        String error = describe(err);

        if (err instanceof InvalidEventException && props.isParkInvalidEvents()) {
            log.error("Parking invalid event event_id={} subject={} err={}", event.id(), event.subject(), error);
            return park(message, binding, record, "Invalid event: " + error);
        }

        if (err instanceof DependencyNotReadyException) {
            log.warn("Dependency not replicated yet, will retry event_id={} subject={} err={}",
                    event.id(), event.subject(), error);
        } else {
            log.error("Event handling failed, will retry event_id={} subject={} stream={}",
                    event.id(), event.subject(), binding.getName(), err);
        }

        return gate.markFailed(record, error)
                .onErrorResume(recordErr -> {
                    log.error("Could not record failure in inbox event_id={} err={}", event.id(), recordErr.toString());
                    return Mono.empty();
                })
                .then(Mono.fromCallable(() -> {
                    nak(message, binding, event.id());
                    return Disposition.RETRY;
                }));
    }

    private Mono<Disposition> park(InboundMessage message, StreamBinding binding, InboxRecord record, String reason) {
        return gate.park(record, reason)
                .then(Mono.fromCallable(() -> {
                    ack(message, binding, record.eventId());
                    return Disposition.PARKED;
                }))
                .onErrorResume(err -> {
                    log.error("Could not park event, will retry event_id={} err={}", record.eventId(), err.toString());
                    nak(message, binding, record.eventId());
                    return Mono.just(Disposition.RETRY);
                });
    }

    private void ack(InboundMessage message, StreamBinding binding, String eventId) {
        try {
            message.ack();
        } catch (RuntimeException e) {
            log.warn("Ack failed stream={} event_id={} err={}", binding.getName(), eventId, e.toString());
        }
    }

    private void nak(InboundMessage message, StreamBinding binding, String eventId) {
        try {
            message.nak(props.getNakDelay());
        } catch (RuntimeException e) {
            log.warn("Nak failed stream={} event_id={} err={}", binding.getName(), eventId, e.toString());
        }
    }

    static String describe(Throwable err) {
        if (err instanceof TimeoutException) {
            return "Handler timed out";
        }
        String message = err.getMessage();
        return (message == null || message.isBlank()) ? err.getClass().getSimpleName() : message;
    }

    static String preview(byte[] body) {
        if (body == null) {
            return "";
        }
        String raw = new String(body, StandardCharsets.UTF_8);
        return raw.length() <= RAW_PREVIEW_CHARS ? raw : raw.substring(0, RAW_PREVIEW_CHARS);
    }
}
