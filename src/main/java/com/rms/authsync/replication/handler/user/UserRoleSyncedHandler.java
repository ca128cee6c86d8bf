package com.rms.authsync.replication.handler.user;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
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
 * Replaces a user's roles with {@code roles.to} and recomputes the {@code Admin}/{@code User} flag.
 * A bare {@code roles} list is accepted as the final set too.
 */
@Component
public class UserRoleSyncedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(UserRoleSyncedHandler.class);

    private final UserReplicaStore users;
    private final ReferenceResolver resolver;
    private final ReplicationProperties props;

    public UserRoleSyncedHandler(UserReplicaStore users, ReferenceResolver resolver, ReplicationProperties props) {
        this.users = users;
        this.resolver = resolver;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_ROLE_SYNCED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long userId = Payloads.requireId(event, "user_id");
        JsonNode roles = Payloads.locate(event, "roles");
        JsonNode finalSet = roles.isObject() ? roles.path("to") : roles;
        if (!finalSet.isArray()) {
            log.debug("No final role list user_id={}", userId);
            return Mono.empty();
        }
        List<String> names = Payloads.names(finalSet);
        String flag = UserRoles.containsAdmin(names, props.getAdminRoleName())
                ? ReplicatedUser.ROLE_ADMIN : ReplicatedUser.ROLE_USER;

        return resolver.requireUser(userId)
                .then(resolver.requireRoleIds(names, props.getGuardName()))
                .flatMap(ids -> users.replaceRoles(userId, ids))
                .then(users.updateRole(userId, flag))
                .then();
    }
}
