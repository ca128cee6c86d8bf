package com.rms.authsync.replication.handler.permission;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.PermissionReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

@Component
public class PermissionUpdatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(PermissionUpdatedHandler.class);

    private final PermissionReplicaStore permissions;

    public PermissionUpdatedHandler(PermissionReplicaStore permissions) {
        this.permissions = permissions;
    }

    @Override
    public String subject() {
        return EventSubjects.PERMISSION_UPDATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long permissionId = Payloads.requireId(event, "permission_id");
        JsonNode changed = Payloads.locate(event, "changed_fields");

        Optional<String> name = Payloads.changedValue(changed, "name");
        Optional<String> guard = Payloads.changedValue(changed, "guard_name");
        if (name.isEmpty() && guard.isEmpty()) {
            return Mono.empty();
        }

        return permissions.update(permissionId, name.orElse(null), guard.orElse(null))
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.debug("Update for unknown permission ignored permission_id={}", permissionId);
                    }
                })
                .then();
    }
}
