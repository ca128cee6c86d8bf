package com.rms.authsync.replication;

import com.rms.authsync.core.model.EventEnvelope;

import reactor.core.publisher.Mono;

/**
 * Applies one event subject to the local read model.
 *
 * <p>Handlers run inside the inbox transaction opened by the caller. They signal failure through
 * the returned {@link Mono}: {@link com.rms.authsync.core.error.DependencyNotReadyException} when a
 * referenced entity is not replicated yet, {@link com.rms.authsync.core.error.InvalidEventException}
 * when a mandatory field is missing. They never create an upstream-owned entity they were only
 * told to reference.</p>
 */
public interface ReplicationHandler {

    /**
     * @return the single subject this handler is registered for
     */
    String subject();

    Mono<Void> apply(EventEnvelope event);
}
