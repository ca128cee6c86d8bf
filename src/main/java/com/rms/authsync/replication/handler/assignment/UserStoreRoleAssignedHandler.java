package com.rms.authsync.replication.handler.assignment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.StoreRoleAssignment;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.StoreRoleAssignmentStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * Creates or replaces a store-scoped role assignment under its upstream assignment id.
 *
 * <h2>Payload ({@code assignment})</h2>
 * <ul>
 *   <li>{@code id}, {@code user_id}, {@code role_id}: required, positive.</li>
 *   <li>{@code store_id}: absent, null or non-positive means "all stores".</li>
 *   <li>{@code is_active}: defaults to true.</li>
 *   <li>{@code metadata} (or {@code meta}): stored as a JSON object; scalars are wrapped as
 *       {@code {"value": x}}.</li>
 *   <li>{@code role_name}, else {@code role.name}, else the {@code role_id_<n>} placeholder that the
 *       removal handler falls back to.</li>
 * </ul>
 *
 * <p>The user, and the store when one is given, must already be replicated.</p>
 */
@Component
public class UserStoreRoleAssignedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(UserStoreRoleAssignedHandler.class);

    private final StoreRoleAssignmentStore assignments;
    private final ReferenceResolver resolver;
    private final ReplicationProperties props;

    public UserStoreRoleAssignedHandler(StoreRoleAssignmentStore assignments, ReferenceResolver resolver,
                                        ReplicationProperties props) {
        this.assignments = assignments;
        this.resolver = resolver;
        this.props = props;
    }

    @Override
    public String subject() {
        return EventSubjects.USER_STORE_ROLE_ASSIGNED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        return assign(event, Payloads.requireObject(event, "assignment"));
    }

    /**
     * Applies one assignment object. Shared with the bulk handler.
     */
    Mono<Void> assign(EventEnvelope event, JsonNode a) {
        long id = Payloads.requireId(event, a, "id");
        long userId = Payloads.requireId(event, a, "user_id");
        long roleId = Payloads.requireId(event, a, "role_id");
        long rawStoreId = Payloads.id(a.path("store_id"));
        Long storeId = rawStoreId > 0 ? rawStoreId : null;

        boolean active = Payloads.bool(a.path("is_active")).orElse(Boolean.TRUE);
        String roleName = Payloads.text(a.path("role_name"))
                .or(() -> Payloads.text(a.path("role").path("name")))
                .orElse(props.placeholderRoleName(roleId));

        StoreRoleAssignment assignment = new StoreRoleAssignment(id, userId, storeId, roleName, active, meta(a));

        Mono<Void> storeCheck = storeId == null ? Mono.empty() : resolver.requireStore(storeId);

        return resolver.requireUser(userId)
                .then(storeCheck)
                .then(assignments.upsert(assignment))
                .doOnSuccess(v -> log.debug("Replicated store role assignment id={} user_id={} store_id={} role={}",
                        id, userId, storeId, roleName));
    }

    private static String meta(JsonNode a) {
        JsonNode meta = a.path("metadata");
        if (meta.isMissingNode() || meta.isNull()) {
            meta = a.path("meta");
        }
        if (meta.isMissingNode() || meta.isNull()) {
            return null;
        }
        if (meta.isObject()) {
            return meta.toString();
        }
        ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
        wrapped.set("value", meta);
        return wrapped.toString();
    }
}
