package com.rms.authsync.replication.handler.role;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

@Component
public class RoleUpdatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(RoleUpdatedHandler.class);

    private final RoleReplicaStore roles;

    public RoleUpdatedHandler(RoleReplicaStore roles) {
        this.roles = roles;
    }

    @Override
    public String subject() {
        return EventSubjects.ROLE_UPDATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long roleId = Payloads.requireId(event, "role_id");
        JsonNode changed = Payloads.locate(event, "changed_fields");

        Optional<String> name = Payloads.changedValue(changed, "name");
        Optional<String> guard = Payloads.changedValue(changed, "guard_name");
        if (name.isEmpty() && guard.isEmpty()) {
            return Mono.empty();
        }

        return roles.update(roleId, name.orElse(null), guard.orElse(null))
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.debug("Update for unknown role ignored role_id={}", roleId);
                    }
                })
                .then();
    }
}
