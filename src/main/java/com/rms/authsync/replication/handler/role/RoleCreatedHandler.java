package com.rms.authsync.replication.handler.role;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.ReplicatedPermission;
import com.rms.authsync.core.model.ReplicatedRole;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.PermissionReplicaStore;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code auth.v1.role.created}: role snapshot, optionally with its full permission set.
 *
 * <p>Snapshot permissions carry their upstream ids, so they are upserted here as well; this is how
 * permissions first reach the replica when no {@code permission.created} was published for them.
 * Entries without an id or name are skipped. A non-empty snapshot replaces the role's permissions.</p>
 */
@Component
public class RoleCreatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(RoleCreatedHandler.class);

    private final RoleReplicaStore roles;
    private final PermissionReplicaStore permissions;
    private final ReplicationProperties props;

    public RoleCreatedHandler(RoleReplicaStore roles, PermissionReplicaStore permissions,
                              ReplicationProperties props) {
        this.roles = roles;
        this.permissions = permissions;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.ROLE_CREATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        ObjectNode role = Payloads.requireObject(event, "role");
        long id = Payloads.requireId(event, role, "id");
        String name = Payloads.text(role.path("name"))
                .orElseThrow(() -> new InvalidEventException(event.subject() + ": missing role.name"));
        String guard = Payloads.text(role.path("guard_name")).orElse(props.getGuardName());

        List<ReplicatedPermission> snapshot = snapshot(role.path("permissions"), guard);
        List<Long> permissionIds = snapshot.stream().map(ReplicatedPermission::id).toList();

        Mono<Void> syncPermissions = snapshot.isEmpty() ? Mono.empty()
                : Flux.fromIterable(snapshot)
                        .concatMap(permissions::upsert)
                        .then(roles.replacePermissions(id, permissionIds));

        return roles.upsert(new ReplicatedRole(id, name, guard))
                .then(syncPermissions)
                .doOnSuccess(v -> log.debug("Replicated role id={} name={} permissions={}", id, name, permissionIds));
    }

    private static List<ReplicatedPermission> snapshot(JsonNode node, String roleGuard) {
        List<ReplicatedPermission> out = new ArrayList<>();
        if (!node.isArray()) {
            return out;
        }
        for (JsonNode p : node) {
            if (!p.isObject()) {
                continue;
            }
            long pid = Payloads.id(p.path("id"));
            String pname = Payloads.text(p.path("name")).orElse(null);
            if (pid <= 0 || pname == null) {
                continue;
            }
            out.add(new ReplicatedPermission(pid, pname, Payloads.text(p.path("guard_name")).orElse(roleGuard)));
        }
        return out;
    }
}
