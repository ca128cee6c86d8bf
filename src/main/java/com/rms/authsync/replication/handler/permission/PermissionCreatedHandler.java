package com.rms.authsync.replication.handler.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.ReplicatedPermission;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.PermissionReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * {@code auth.v1.permission.created}. The guard is read from {@code guard_name} or, for older
 * producers, {@code guard}.
 */
@Component
public class PermissionCreatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(PermissionCreatedHandler.class);

    private final PermissionReplicaStore permissions;
    private final ReplicationProperties props;

    public PermissionCreatedHandler(PermissionReplicaStore permissions, ReplicationProperties props) {
        this.permissions = permissions;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.PERMISSION_CREATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        ObjectNode permission = Payloads.requireObject(event, "permission");
        long id = Payloads.requireId(event, permission, "id");
        String name = Payloads.text(permission.path("name"))
                .orElseThrow(() -> new InvalidEventException(event.subject() + ": missing permission.name"));
        String guard = Payloads.text(permission.path("guard_name"))
                .or(() -> Payloads.text(permission.path("guard")))
                .orElse(props.getGuardName());

        return permissions.upsert(new ReplicatedPermission(id, name, guard))
                .doOnSuccess(v -> log.debug("Replicated permission id={} name={} guard={}", id, name, guard));
    }
}
