package com.rms.authsync.replication.handler.assignment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.StoreRoleAssignmentStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Flips {@code active} on an assignment to {@code after_is_active}.
 */
@Component
public class UserStoreRoleToggledHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(UserStoreRoleToggledHandler.class);

    private final StoreRoleAssignmentStore assignments;
    private final ReplicationProperties props;

    public UserStoreRoleToggledHandler(StoreRoleAssignmentStore assignments, ReplicationProperties props) {
        this.assignments = assignments;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_STORE_ROLE_TOGGLED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long roleId = Payloads.id(Payloads.locate(event, "role_id"));
        if (roleId > 0 && !props.isReplicatedRole(roleId)) {
            log.debug("Skipping toggle for non-replicated role role_id={}", roleId);
            return Mono.empty();
        }

        long assignmentId = AssignmentIds.of(event);
        if (assignmentId <= 0) {
            throw new InvalidEventException(event.subject() + ": missing or invalid assignment_id");
        }
        boolean active = Payloads.bool(Payloads.locate(event, "after_is_active"))
                .orElseThrow(() -> new InvalidEventException(event.subject() + ": missing after_is_active"));

        return assignments.setActive(assignmentId, active)
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.debug("Toggle for unknown assignment ignored id={}", assignmentId);
                    }
                })
                .then();
    }
}
