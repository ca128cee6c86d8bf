package com.rms.authsync.replication.handler.role;

import org.springframework.stereotype.Component;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

@Component
public class RoleDeletedHandler implements ReplicationHandler {

    private final RoleReplicaStore roles;

    public RoleDeletedHandler(RoleReplicaStore roles) {
        this.roles = roles;
    }

    @Override
    public String subject() {
        return EventSubjects.ROLE_DELETED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        return roles.delete(Payloads.requireId(event, "role_id")).then();
    }
}
