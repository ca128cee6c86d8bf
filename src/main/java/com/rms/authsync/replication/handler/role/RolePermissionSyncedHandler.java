package com.rms.authsync.replication.handler.role;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Replaces a role's permissions with the {@code final} list. An empty list detaches everything; an
 * absent or non-list {@code final} is ignored.
 */
@Component
public class RolePermissionSyncedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(RolePermissionSyncedHandler.class);

    private final RoleReplicaStore roles;
    private final ReferenceResolver resolver;

    public RolePermissionSyncedHandler(RoleReplicaStore roles, ReferenceResolver resolver) {
        this.roles = roles;
        this.resolver = resolver;
    }

    @Override
    public String subject() {
        return EventSubjects.ROLE_PERMISSION_SYNCED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long roleId = Payloads.requireId(event, "role_id");
        JsonNode finalSet = Payloads.locate(event, "final");
        if (!finalSet.isArray()) {
            log.debug("No final permission list role_id={}", roleId);
            return Mono.empty();
        }
        List<String> names = Payloads.names(finalSet);

        return resolver.requireRole(roleId)
                .flatMap(role -> resolver.requirePermissionIds(names, role.guardName()))
                .flatMap(ids -> roles.replacePermissions(roleId, ids))
                .doOnSuccess(v -> log.debug("Synced permissions role_id={} permissions={}", roleId, names));
    }
}
