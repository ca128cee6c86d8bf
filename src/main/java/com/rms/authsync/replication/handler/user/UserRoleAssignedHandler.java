package com.rms.authsync.replication.handler.user;

import java.util.List;

import org.springframework.stereotype.Component;

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
 * Adds roles to a user. Granting the admin role also raises {@code users.role} to {@code Admin}.
 */
@Component
public class UserRoleAssignedHandler implements ReplicationHandler {

    private final UserReplicaStore users;
    private final ReferenceResolver resolver;
    private final ReplicationProperties props;

    public UserRoleAssignedHandler(UserReplicaStore users, ReferenceResolver resolver, ReplicationProperties props) {
        this.users = users;
        this.resolver = resolver;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_ROLE_ASSIGNED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long userId = Payloads.requireId(event, "user_id");
        List<String> names = Payloads.names(Payloads.locate(event, "roles"));
        if (names.isEmpty()) {
            return Mono.empty();
        }

        Mono<Void> flag = UserRoles.containsAdmin(names, props.getAdminRoleName())
                ? users.updateRole(userId, ReplicatedUser.ROLE_ADMIN).then()
                : Mono.empty();

        return resolver.requireUser(userId)
                .then(resolver.requireRoleIds(names, props.getGuardName()))
                .flatMap(ids -> users.attachRoles(userId, ids))
                .then(flag);
    }
}
