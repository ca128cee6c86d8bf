package com.rms.authsync.replication.handler.role;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Grants permissions, by name, to a role without touching its other permissions.
 *
 * <p>Fail-closed: the role and every named permission (under the role's guard) must already be
 * replicated; otherwise nothing is attached and the event is retried.</p>
 */
@Component
public class RolePermissionAssignedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(RolePermissionAssignedHandler.class);

    private final RoleReplicaStore roles;
    private final ReferenceResolver resolver;

    public RolePermissionAssignedHandler(RoleReplicaStore roles, ReferenceResolver resolver) {
        this.roles = roles;
        this.resolver = resolver;
    }

    @Override
    public String subject() {
        return EventSubjects.ROLE_PERMISSION_ASSIGNED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long roleId = Payloads.requireId(event, "role_id");
        List<String> names = Payloads.names(Payloads.locate(event, "permissions"));
        if (names.isEmpty()) {
            return Mono.empty();
        }

        return resolver.requireRole(roleId)
                .flatMap(role -> resolver.requirePermissionIds(names, role.guardName()))
                .flatMap(ids -> roles.attachPermissions(roleId, ids))
                .doOnSuccess(v -> log.debug("Attached permissions role_id={} permissions={}", roleId, names));
    }
}
