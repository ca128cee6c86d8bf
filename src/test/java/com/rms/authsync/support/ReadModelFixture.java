package com.rms.authsync.support;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.authsync.core.codec.EventEnvelopeCodec;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.jetstream.config.JacksonConfig;
import com.rms.authsync.jetstream.config.ReplicationProperties;
import com.rms.authsync.r2dbc.service.InboxGate;
import com.rms.authsync.r2dbc.store.InboxEventStore;
import com.rms.authsync.r2dbc.store.PermissionReplicaStore;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.r2dbc.store.StoreReplicaStore;
import com.rms.authsync.r2dbc.store.StoreRoleAssignmentStore;
import com.rms.authsync.r2dbc.store.UserReplicaStore;
import com.rms.authsync.replication.EventRouter;
import com.rms.authsync.replication.ReferenceResolver;
import com.rms.authsync.replication.ReplicationHandler;
import com.rms.authsync.replication.handler.assignment.UserStoreRoleAssignedHandler;
import com.rms.authsync.replication.handler.assignment.UserStoreRoleBulkAssignedHandler;
import com.rms.authsync.replication.handler.assignment.UserStoreRoleRemovedHandler;
import com.rms.authsync.replication.handler.assignment.UserStoreRoleToggledHandler;
import com.rms.authsync.replication.handler.permission.PermissionCreatedHandler;
import com.rms.authsync.replication.handler.permission.PermissionDeletedHandler;
import com.rms.authsync.replication.handler.permission.PermissionUpdatedHandler;
import com.rms.authsync.replication.handler.role.RoleCreatedHandler;
import com.rms.authsync.replication.handler.role.RoleDeletedHandler;
import com.rms.authsync.replication.handler.role.RolePermissionAssignedHandler;
import com.rms.authsync.replication.handler.role.RolePermissionRevokedHandler;
import com.rms.authsync.replication.handler.role.RolePermissionSyncedHandler;
import com.rms.authsync.replication.handler.role.RoleUpdatedHandler;
import com.rms.authsync.replication.handler.store.StoreCreatedHandler;
import com.rms.authsync.replication.handler.store.StoreDeletedHandler;
import com.rms.authsync.replication.handler.store.StoreUpdatedHandler;
import com.rms.authsync.replication.handler.user.UserCreatedHandler;
import com.rms.authsync.replication.handler.user.UserDeletedHandler;
import com.rms.authsync.replication.handler.user.UserPermissionGrantedHandler;
import com.rms.authsync.replication.handler.user.UserPermissionRevokedHandler;
import com.rms.authsync.replication.handler.user.UserPermissionSyncedHandler;
import com.rms.authsync.replication.handler.user.UserRoleAssignedHandler;
import com.rms.authsync.replication.handler.user.UserRoleRemovedHandler;
import com.rms.authsync.replication.handler.user.UserRoleSyncedHandler;
import com.rms.authsync.replication.handler.user.UserUpdatedHandler;

import io.r2dbc.h2.H2ConnectionConfiguration;
import io.r2dbc.h2.H2ConnectionFactory;
import io.r2dbc.h2.H2ConnectionOption;
import io.r2dbc.spi.ConnectionFactory;

/**
 * Wires the read model by hand against a private in-memory H2 database (PostgreSQL mode) loaded
 * from the production {@code schema.sql}.
 */
public final class ReadModelFixture {

    public final ConnectionFactory connectionFactory;
    public final DatabaseClient db;
    public final TransactionalOperator tx;
    public final ObjectMapper mapper = new JacksonConfig().objectMapper();
    public final EventEnvelopeCodec codec = new EventEnvelopeCodec(mapper);
    public final ReplicationProperties replicationProps = new ReplicationProperties();

    public final InboxEventStore inbox;
    public final UserReplicaStore users;
    public final StoreReplicaStore stores;
    public final RoleReplicaStore roles;
    public final PermissionReplicaStore permissions;
    public final StoreRoleAssignmentStore assignments;

    public final ReferenceResolver resolver;
    public final InboxGate gate;
    public final EventRouter router;

    private ReadModelFixture() {
        connectionFactory = new H2ConnectionFactory(H2ConnectionConfiguration.builder()
                .inMemory("authsync-" + UUID.randomUUID())
                .username("sa")
                .property(H2ConnectionOption.DB_CLOSE_DELAY, "-1")
                .property(H2ConnectionOption.MODE, "PostgreSQL")
                .build());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(connectionFactory).block();

        db = DatabaseClient.create(connectionFactory);
        tx = TransactionalOperator.create(new R2dbcTransactionManager(connectionFactory));

        inbox = new InboxEventStore(db);
        users = new UserReplicaStore(db);
        stores = new StoreReplicaStore(db);
        roles = new RoleReplicaStore(db);
        permissions = new PermissionReplicaStore(db);
        assignments = new StoreRoleAssignmentStore(db);

        resolver = new ReferenceResolver(users, stores, roles, permissions);
        gate = new InboxGate(inbox, tx);
        router = new EventRouter(handlers());
    }

    public static ReadModelFixture create() {
        return new ReadModelFixture();
    }

    private List<ReplicationHandler> handlers() {
        ReplicationProperties p = replicationProps;
        UserStoreRoleAssignedHandler assigned = new UserStoreRoleAssignedHandler(assignments, resolver, p);
        return List.of(
                new UserCreatedHandler(users, resolver, p),
                new UserUpdatedHandler(users),
                new UserDeletedHandler(users),
                new UserRoleAssignedHandler(users, resolver, p),
                new UserRoleRemovedHandler(users, resolver, p),
                new UserRoleSyncedHandler(users, resolver, p),
                new UserPermissionGrantedHandler(users, resolver, p),
                new UserPermissionRevokedHandler(users, resolver, p),
                new UserPermissionSyncedHandler(users, resolver, p),
                new StoreCreatedHandler(stores, p, mapper),
                new StoreUpdatedHandler(stores, p, mapper),
                new StoreDeletedHandler(stores),
                new RoleCreatedHandler(roles, permissions, p),
                new RoleUpdatedHandler(roles),
                new RoleDeletedHandler(roles),
                new RolePermissionAssignedHandler(roles, resolver),
                new RolePermissionRevokedHandler(roles, resolver),
                new RolePermissionSyncedHandler(roles, resolver),
                new PermissionCreatedHandler(permissions, p),
                new PermissionUpdatedHandler(permissions),
                new PermissionDeletedHandler(permissions),
                assigned,
                new UserStoreRoleBulkAssignedHandler(assigned),
                new UserStoreRoleRemovedHandler(assignments, p),
                new UserStoreRoleToggledHandler(assignments, p));
    }

    /**
     * Envelope with a random id, the given subject and {@code dataJson} as its data object.
     */
    public EventEnvelope event(String subject, String dataJson) {
        return eventWithId(UUID.randomUUID().toString(), subject, dataJson);
    }

    public EventEnvelope eventWithId(String id, String subject, String dataJson) {
        String body = "{\"id\":\"" + id + "\",\"subject\":\"" + subject + "\",\"source\":\"test\",\"data\":"
                + dataJson + "}";
        return codec.decode(body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Applies one event directly through its handler in a transaction, bypassing the inbox.
     */
    public void apply(EventEnvelope event) {
        router.resolve(event.subject()).apply(event).as(tx::transactional).block();
    }

    public void apply(String subject, String dataJson) {
        apply(event(subject, dataJson));
    }

    public long count(String sql) {
        return db.sql(sql).map((row, meta) -> row.get(0, Long.class)).one().block();
    }
}
