package com.rms.authsync.r2dbc.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.rms.authsync.core.model.Admission;
import com.rms.authsync.core.model.InboxRecord;
import com.rms.authsync.r2dbc.store.InboxEventStore;

import reactor.core.publisher.Mono;

/**
 * Idempotency gate over the {@code event_inbox} table.
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>{@link #admit(InboxRecord)} runs inside the caller's transaction: it creates the row if needed
 *       and takes a row lock ({@code SELECT ... FOR UPDATE}) that is held until that transaction ends.</li>
 *   <li>On {@link Admission#SHOULD_PROCESS} the caller applies the event and calls {@link #markDone(String)}
 *       in the same transaction.</li>
 *   <li>If the transaction rolls back, the caller records the failure with {@link #markFailed} or
 *       {@link #park}, each of which commits on its own.</li>
 * </ol>
 *
 * <p>Two deliveries of the same id serialize on the row lock; the second one sees
 * {@code processed_at} and gets {@link Admission#ALREADY_DONE}.</p>
 */
@Service
public class InboxGate {

    private static final Logger log = LoggerFactory.getLogger(InboxGate.class);

    private final InboxEventStore store;
    private final TransactionalOperator tx;

    public InboxGate(InboxEventStore store, TransactionalOperator tx) {
        this.store = store;
        this.tx = tx;
    }

    public Mono<Admission> admit(InboxRecord record) {
        return store.insertIfAbsent(record)
                .then(store.lockAndCheckProcessed(record.eventId()))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                        "Inbox row vanished after insert event_id=" + record.eventId())))
                .map(processed -> processed ? Admission.ALREADY_DONE : Admission.SHOULD_PROCESS);
    }

    public Mono<Void> markDone(String eventId) {
        return store.markProcessed(eventId).then();
    }

    /**
     * Records a failed attempt in its own transaction. The row is re-created first because a rolled
     * back first attempt also rolled back the insert done by {@link #admit}.
     */
    public Mono<Void> markFailed(InboxRecord record, String error) {
        return store.insertIfAbsent(record)
                .then(store.recordFailure(record.eventId(), error))
                .as(tx::transactional)
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.debug("Failure not recorded, event already processed event_id={}", record.eventId());
                    }
                })
                .then();
    }

    /**
     * Dead-letters the event: {@code last_error} gets the reason, {@code parked_at} is set and
     * {@code processed_at} stays null.
     */
    public Mono<Void> park(InboxRecord record, String reason) {
        return store.insertIfAbsent(record)
                .then(store.park(record.eventId(), reason))
                .as(tx::transactional)
                .then();
    }
}
