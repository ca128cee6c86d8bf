package com.rms.authsync.replication.handler.user;

import java.util.List;

import org.springframework.stereotype.Component;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.UserReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Adds direct permissions to a user; every name must already be replicated.
 */
@Component
public class UserPermissionGrantedHandler implements ReplicationHandler {

    private final UserReplicaStore users;
    private final ReferenceResolver resolver;
    private final ReplicationProperties props;

    public UserPermissionGrantedHandler(UserReplicaStore users, ReferenceResolver resolver,
                                        ReplicationProperties props) {
        this.users = users;
        this.resolver = resolver;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_PERMISSION_GRANTED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long userId = Payloads.requireId(event, "user_id");
        List<String> names = Payloads.names(Payloads.locate(event, "permissions"));
        if (names.isEmpty()) {
            return Mono.empty();
        }

        return resolver.requireUser(userId)
                .then(resolver.requirePermissionIds(names, props.getGuardName()))
                .flatMap(ids -> users.attachPermissions(userId, ids));
    }
}
