package com.rms.authsync.replication.handler.assignment;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Applies every object in {@code assignments} in order, through the single-assignment logic.
 * The whole batch shares one inbox transaction, so one failing entry rolls back the others.
 */
@Component
public class UserStoreRoleBulkAssignedHandler implements ReplicationHandler {

    private final UserStoreRoleAssignedHandler single;

    public UserStoreRoleBulkAssignedHandler(UserStoreRoleAssignedHandler single) {
        this.single = single;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_STORE_ROLE_BULK_ASSIGNED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        JsonNode list = Payloads.locate(event, "assignments");
        if (!list.isArray()) {
            throw new InvalidEventException(event.subject() + ": missing 'assignments' list");
        }
        return Flux.fromIterable(list)
                .filter(JsonNode::isObject)
                .concatMap(a -> Mono.defer(() -> single.assign(event, a)))
                .then();
    }
}
