package com.rms.authsync.replication.handler.store;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.authsync.core.error.DependencyNotReadyException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.ReplicatedStore;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.store.StoreReplicaStore;
import com.rms.authsync.replication.Payloads;
import com.rms.authsync.replication.ReplicationHandler;

import reactor.core.publisher.Mono;

/**
 * {@code auth.v1.store.updated}.
 *
 * <ul>
 *   <li>{@code changed_fields.name} sets the name.</li>
 *   <li>A present {@code changed_fields.metadata} recomputes the group from its {@code to} side,
 *       falling back to the default group when it holds none.</li>
 *   <li>An unknown store is inserted when the delta carries a name; otherwise the event waits for
 *       {@code store.created}.</li>
 * </ul>
 */
@Component
public class StoreUpdatedHandler implements ReplicationHandler {

    private static final Logger log = LoggerFactory.getLogger(StoreUpdatedHandler.class);

    private final StoreReplicaStore stores;
    private final ReplicationProperties props;
    private final ObjectMapper mapper;

    public StoreUpdatedHandler(StoreReplicaStore stores, ReplicationProperties props, ObjectMapper mapper) {
        this.stores = stores;
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public String subject() {
        return EventSubjects.STORE_UPDATED;
    }

    @Override
    public Mono<Void> apply(EventEnvelope event) {
        long storeId = Payloads.requireId(event, "store_id");
        JsonNode changed = Payloads.locate(event, "changed_fields");

        Optional<String> name = Payloads.changedValue(changed, "name");
        JsonNode metadata = Payloads.changedNode(changed, "metadata");
        Integer group = metadata.isMissingNode() ? null
                : Payloads.groupNumber(metadata, mapper, props.getDefaultStoreGroup());

        if (name.isEmpty() && group == null) {
            log.debug("No applicable changes store_id={}", storeId);
            return Mono.empty();
        }

        return stores.update(storeId, name.orElse(null), group)
                .flatMap(rows -> {
                    if (rows > 0) {
                        return Mono.<Void>empty();
                    }
                    if (name.isEmpty()) {
                        return Mono.<Void>error(new DependencyNotReadyException(
                                "Store " + storeId + " not found and update carries no name"));
                    }
                    int effectiveGroup = group == null ? props.getDefaultStoreGroup() : group;
                    return stores.upsert(new ReplicatedStore(storeId, name.get(), effectiveGroup));
                });
    }
}
