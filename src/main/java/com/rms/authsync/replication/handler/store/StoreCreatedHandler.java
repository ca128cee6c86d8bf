package com.rms.authsync.replication.handler.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.ReplicatedStore;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.StoreReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * {@code auth.v1.store.created}: upserts the store, deriving its access group from
 * {@code store.metadata}.
 */
@Component
public class StoreCreatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(StoreCreatedHandler.class);

    private final StoreReplicaStore stores;
    private final ReplicationProperties props;
    private final ObjectMapper mapper;

    public StoreCreatedHandler(StoreReplicaStore stores, ReplicationProperties props, ObjectMapper mapper) {
        this.stores = stores;
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public String subject() {
        return EventSubjects.STORE_CREATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        ObjectNode store = Payloads.requireObject(event, "store");
        long id = Payloads.requireId(event, store, "id");
        String name = Payloads.text(store.path("name"))
                .orElseThrow(() -> new InvalidEventException(event.subject() + ": missing store.name"));
        int group = Payloads.groupNumber(store.path("metadata"), mapper, props.getDefaultStoreGroup());

        return stores.upsert(new ReplicatedStore(id, name, group))
                .doOnSuccess(v -> log.debug("Replicated store id={} group={}", id, group));
    }
}
