package com.rms.authsync.replication.handler.user;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.ReplicatedUser;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.UserReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * {@code auth.v1.user.created}: snapshot of a user, optionally with its role names and direct
 * permission names.
 *
 * <p>The user row is upserted by upstream id. Roles and direct permissions are replaced only when
 * the snapshot carries a non-empty list, and every name must already be replicated.</p>
 */
@Component
public class UserCreatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(UserCreatedHandler.class);

    private final UserReplicaStore users;
    private final ReferenceResolver resolver;
    private final ReplicationProperties props;

    public UserCreatedHandler(UserReplicaStore users, ReferenceResolver resolver, ReplicationProperties props) {
        this.users = users;
        this.resolver = resolver;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_CREATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        ObjectNode user = Payloads.requireObject(event, "user");
        long id = Payloads.requireId(event, user, "id");
        String email = Payloads.text(user.path("email"))
                .orElseThrow(() -> new InvalidEventException(event.subject() + ": missing user.email"));
        String name = Payloads.text(user.path("name")).orElse(email);

        List<String> roleNames = Payloads.names(rolesOf(event, user));
        List<String> directPermissions = Payloads.names(Payloads.locate(event, "permissions_direct"));
        String roleFlag = UserRoles.containsAdmin(roleNames, props.getAdminRoleName())
                ? ReplicatedUser.ROLE_ADMIN : ReplicatedUser.ROLE_USER;

        Mono<Void> syncRoles = roleNames.isEmpty() ? Mono.empty()
                : resolver.requireRoleIds(roleNames, props.getGuardName())
                        .flatMap(ids -> users.replaceRoles(id, ids));

        Mono<Void> syncPermissions = directPermissions.isEmpty() ? Mono.empty()
                : resolver.requirePermissionIds(directPermissions, props.getGuardName())
                        .flatMap(ids -> users.replacePermissions(id, ids));

        return users.upsert(new ReplicatedUser(id, name, email, roleFlag))
                .then(syncRoles)
                .then(syncPermissions)
                .doOnSuccess(v -> log.debug("Replicated user id={} role={} roles={} permissions={}",
                        id, roleFlag, roleNames, directPermissions));
    }

    private static JsonNode rolesOf(EventEnvelope event, ObjectNode user) {
        JsonNode roles = Payloads.locate(event, "roles");
        return roles.isArray() ? roles : user.path("roles");
    }
}
