package com.rms.authsync.replication.handler.store;

import org.springframework.stereotype.Component;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.StoreReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

@Component
public class StoreDeletedHandler implements ReplicationHandler {

    private final StoreReplicaStore stores;

    public StoreDeletedHandler(StoreReplicaStore stores) {
        this.stores = stores;
    }

    @Override
    public String subject() {
        return EventSubjects.STORE_DELETED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        return stores.delete(Payloads.requireId(event, "store_id")).then();
    }
}
