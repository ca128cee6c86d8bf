package com.rms.authsync.replication.handler.permission;

import org.springframework.stereotype.Component;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.PermissionReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

@Component
public class PermissionDeletedHandler implements ReplicationHandler {

    private final PermissionReplicaStore permissions;

    public PermissionDeletedHandler(PermissionReplicaStore permissions) {
        this.permissions = permissions;
    }

    @Override
    public String subject() {
        return EventSubjects.PERMISSION_DELETED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        return permissions.delete(Payloads.requireId(event, "permission_id")).then();
    }
}
