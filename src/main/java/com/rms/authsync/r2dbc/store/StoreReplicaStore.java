package com.rms.authsync.r2dbc.store;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.authsync.core.model.ReplicatedStore;

import reactor.core.publisher.Mono;

/**
 * Replicated stores (physical locations), keyed by upstream store id.
 */
@Repository
public class StoreReplicaStore {

	private final DatabaseClient db;

	public StoreReplicaStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<ReplicatedStore> findById(long id) {
		return db.sql("SELECT id, name, group_number FROM stores WHERE id = :id").bind("id", id)
				.map((row, meta) -> new ReplicatedStore(row.get("id", Long.class), row.get("name", String.class),
						row.get("group_number", Integer.class)))
				.one();
	}

	public Mono<Boolean> exists(long id) {
		return db.sql("SELECT id FROM stores WHERE id = :id").bind("id", id).map((row, meta) -> Boolean.TRUE).one()
				.defaultIfEmpty(Boolean.FALSE);
	}

	public Mono<Void> upsert(ReplicatedStore store) {
		return update(store.id(), store.name(), store.groupNumber())
				.flatMap(updated -> updated > 0 ? Mono.empty()
						: db.sql("INSERT INTO stores (id, name, group_number) VALUES (:id, :name, :group_number)")
								.bind("id", store.id()).bind("name", store.name())
								.bind("group_number", store.groupNumber()).fetch().rowsUpdated())
				.then();
	}

	/**
	 * Applies whichever of {@code name}/{@code groupNumber} is non-null; returns rows updated.
	 */
	public Mono<Long> update(long id, String name, Integer groupNumber) {
		StringBuilder sql = new StringBuilder("UPDATE stores SET updated_at = CURRENT_TIMESTAMP");
		if (name != null) {
			sql.append(", name = :name");
		}
		if (groupNumber != null) {
			sql.append(", group_number = :group_number");
		}
		sql.append(" WHERE id = :id");

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString()).bind("id", id);
		if (name != null) {
			spec = spec.bind("name", name);
		}
		if (groupNumber != null) {
			spec = spec.bind("group_number", groupNumber);
		}
		return spec.fetch().rowsUpdated();
	}

	public Mono<Long> delete(long id) {
		return db.sql("DELETE FROM stores WHERE id = :id").bind("id", id).fetch().rowsUpdated();
	}
}
