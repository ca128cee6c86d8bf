package com.rms.authsync.replication.handler.user;

import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.UserReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Replaces a user's direct permissions with {@code permissions.to}.
 */
@Component
public class UserPermissionSyncedHandler implements ReplicationHandler {

    private final UserReplicaStore users;
    private final ReferenceResolver resolver;
    private final ReplicationProperties props;

    public UserPermissionSyncedHandler(UserReplicaStore users, ReferenceResolver resolver,
                                       ReplicationProperties props) {
        this.users = users;
        this.resolver = resolver;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_PERMISSION_SYNCED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long userId = Payloads.requireId(event, "user_id");
        JsonNode permissions = Payloads.locate(event, "permissions");
        JsonNode finalSet = permissions.isObject() ? permissions.path("to") : permissions;
        if (!finalSet.isArray()) {
            throw new InvalidEventException(event.subject() + ": permissions.to must be a list");
        }
        List<String> names = Payloads.names(finalSet);

        return resolver.requireUser(userId)
                .then(resolver.requirePermissionIds(names, props.getGuardName()))
                .flatMap(ids -> users.replacePermissions(userId, ids));
    }
}
