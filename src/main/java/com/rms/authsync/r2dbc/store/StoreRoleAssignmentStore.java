package com.rms.authsync.r2dbc.store;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.authsync.core.model.StoreRoleAssignment;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code user_store_roles}: store-scoped role assignments keyed by the upstream assignment id.
 *
 * A null {@code store_id} means "all stores of the user" and is matched with {@code IS NULL}, never
 * with {@code = NULL}.
 */
@Repository
public class StoreRoleAssignmentStore {

	private final DatabaseClient db;

	public StoreRoleAssignmentStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<StoreRoleAssignment> findById(long id) {
		return db.sql("SELECT id, user_id, store_id, role_name, active, meta FROM user_store_roles WHERE id = :id")
				.bind("id", id).map((row, meta) -> toModel(row)).one();
	}

	public Flux<StoreRoleAssignment> findByUser(long userId) {
		return db.sql("SELECT id, user_id, store_id, role_name, active, meta FROM user_store_roles "
				+ "WHERE user_id = :user_id ORDER BY id").bind("user_id", userId).map((row, meta) -> toModel(row))
				.all();
	}

	public Mono<Void> upsert(StoreRoleAssignment a) {
		String update = "UPDATE user_store_roles SET user_id = :user_id, store_id = :store_id, role_name = :role_name, "
				+ "active = :active, meta = :meta, updated_at = CURRENT_TIMESTAMP WHERE id = :id";
		String insert = "INSERT INTO user_store_roles (id, user_id, store_id, role_name, active, meta) "
				+ "VALUES (:id, :user_id, :store_id, :role_name, :active, :meta)";

		return bindAssignment(db.sql(update), a).fetch().rowsUpdated()
				.flatMap(updated -> updated > 0 ? Mono.empty() : bindAssignment(db.sql(insert), a).fetch().rowsUpdated())
				.then();
	}

	public Mono<Long> deleteById(long id) {
		return db.sql("DELETE FROM user_store_roles WHERE id = :id").bind("id", id).fetch().rowsUpdated();
	}

	public Mono<Long> deleteByComposite(long userId, Long storeId, String roleName) {
		if (storeId == null) {
			return db.sql("DELETE FROM user_store_roles WHERE user_id = :user_id AND role_name = :role_name "
					+ "AND store_id IS NULL").bind("user_id", userId).bind("role_name", roleName).fetch().rowsUpdated();
		}
		return db.sql("DELETE FROM user_store_roles WHERE user_id = :user_id AND role_name = :role_name "
				+ "AND store_id = :store_id").bind("user_id", userId).bind("role_name", roleName)
				.bind("store_id", storeId).fetch().rowsUpdated();
	}

	public Mono<Long> setActive(long id, boolean active) {
		return db.sql("UPDATE user_store_roles SET active = :active, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
				.bind("active", active).bind("id", id).fetch().rowsUpdated();
	}

	private static DatabaseClient.GenericExecuteSpec bindAssignment(DatabaseClient.GenericExecuteSpec spec,
			StoreRoleAssignment a) {
		spec = spec.bind("id", a.id()).bind("user_id", a.userId()).bind("role_name", a.roleName())
				.bind("active", a.active());
		spec = a.storeId() == null ? spec.bindNull("store_id", Long.class) : spec.bind("store_id", a.storeId());
		return InboxEventStore.bindNullable(spec, "meta", a.meta());
	}

	private static StoreRoleAssignment toModel(Row row) {
		Boolean active = row.get("active", Boolean.class);
		return new StoreRoleAssignment(row.get("id", Long.class), row.get("user_id", Long.class),
				row.get("store_id", Long.class), row.get("role_name", String.class), Boolean.TRUE.equals(active),
				row.get("meta", String.class));
	}
}
