package com.rms.authsync.replication.handler.user;

import org.springframework.stereotype.Component;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.UserReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Role, permission and store-role links go with the user through {@code ON DELETE CASCADE}.
 */
@Component
public class UserDeletedHandler implements ReplicationHandler {

    private final UserReplicaStore users;

    public UserDeletedHandler(UserReplicaStore users) {
        this.users = users;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_DELETED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        return users.delete(Payloads.requireId(event, "user_id")).then();
    }
}
