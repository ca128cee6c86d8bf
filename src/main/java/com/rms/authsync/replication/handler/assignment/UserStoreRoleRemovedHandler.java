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
 * Deletes a store role assignment.
 *
 * <p>By assignment id when the event carries one ({@code assignment_id} or {@code assignment.id}).
 * Otherwise by {@code (user_id, store_id, role_name)}, where a missing store id matches the
 * "all stores" row and the role name defaults to the same {@code role_id_<n>} placeholder used on
 * creation. Deleting nothing is not an error.</p>
 */
@Component
public class UserStoreRoleRemovedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(UserStoreRoleRemovedHandler.class);

    private final StoreRoleAssignmentStore assignments;
    private final ReplicationProperties props;

    public UserStoreRoleRemovedHandler(StoreRoleAssignmentStore assignments, ReplicationProperties props) {
        this.assignments = assignments;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_STORE_ROLE_REMOVED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long assignmentId = AssignmentIds.of(event);
        if (assignmentId > 0) {
            return assignments.deleteById(assignmentId)
                    .doOnNext(rows -> log.debug("Removed store role assignment id={} rows={}", assignmentId, rows))
                    .then();
        }

        long userId = Payloads.id(Payloads.locate(event, "user_id"));
        long roleId = Payloads.id(Payloads.locate(event, "role_id"));
        if (userId <= 0 || roleId <= 0) {
            throw new InvalidEventException(event.subject() + ": missing assignment_id and (user_id, role_id)");
        }
        if (!props.isReplicatedRole(roleId)) {
            log.debug("Skipping removal for non-replicated role user_id={} role_id={}", userId, roleId);
            return Mono.empty();
        }

        long rawStoreId = Payloads.id(Payloads.locate(event, "store_id"));
        Long storeId = rawStoreId > 0 ? rawStoreId : null;
        String roleName = Payloads.text(Payloads.locate(event, "role_name"))
                .orElse(props.placeholderRoleName(roleId));

        return assignments.deleteByComposite(userId, storeId, roleName)
                .doOnNext(rows -> log.debug("Removed store role assignment user_id={} store_id={} role={} rows={}",
                        userId, storeId, roleName, rows))
                .then();
    }
}
