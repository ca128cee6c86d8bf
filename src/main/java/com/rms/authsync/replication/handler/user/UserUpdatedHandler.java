package com.rms.authsync.replication.handler.user;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.r2dbc.store.UserReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * {@code auth.v1.user.updated}: applies {@code changed_fields.name} and {@code changed_fields.email}.
 */
@Component
public class UserUpdatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(UserUpdatedHandler.class);

    private final UserReplicaStore users;

    public UserUpdatedHandler(UserReplicaStore users) {
        this.users = users;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_UPDATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long userId = Payloads.requireId(event, "user_id");
        JsonNode changed = Payloads.locate(event, "changed_fields");

        Optional<String> name = Payloads.changedValue(changed, "name");
        Optional<String> email = Payloads.changedValue(changed, "email");
        if (name.isEmpty() && email.isEmpty()) {
            log.debug("No applicable changes user_id={}", userId);
            return Mono.empty();
        }

        return users.updateProfile(userId, name.orElse(null), email.orElse(null))
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.debug("Update for unknown user ignored user_id={}", userId);
                    }
                })
                .then();
    }
}
