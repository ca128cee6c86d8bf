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
 * Detaches permissions from a role. An unknown role or permission means there is nothing to detach,
 * so neither is an error.
 */
@Component
public class RolePermissionRevokedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(RolePermissionRevokedHandler.class);

    private final RoleReplicaStore roles;
    private final ReferenceResolver resolver;

    public RolePermissionRevokedHandler(RoleReplicaStore roles, ReferenceResolver resolver) {
        this.roles = roles;
        this.resolver = resolver;
    }

    @Override
    public String subject() {
        return EventSubjects.ROLE_PERMISSION_REVOKED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long roleId = Payloads.requireId(event, "role_id");
        List<String> names = Payloads.names(Payloads.locate(event, "permissions"));
        if (names.isEmpty()) {
            return Mono.empty();
        }

        return roles.findById(roleId)
                .flatMap(role -> resolver.existingPermissionIds(names, role.guardName()))
                .flatMap(ids -> roles.detachPermissions(roleId, ids))
                .doOnSuccess(v -> log.debug("Detached permissions role_id={} permissions={}", roleId, names));
    }
}
