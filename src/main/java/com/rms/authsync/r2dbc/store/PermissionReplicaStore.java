package com.rms.authsync.r2dbc.store;

import java.util.Collection;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.authsync.core.model.ReplicatedPermission;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class PermissionReplicaStore {

	private final DatabaseClient db;

	public PermissionReplicaStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<ReplicatedPermission> findById(long id) {
		return db.sql("SELECT id, name, guard_name FROM permissions WHERE id = :id").bind("id", id)
				.map((row, meta) -> toModel(row)).one();
	}

	public Flux<ReplicatedPermission> findByNames(Collection<String> names, String guardName) {
		if (names.isEmpty()) {
			return Flux.empty();
		}
		return db.sql("SELECT id, name, guard_name FROM permissions WHERE guard_name = :guard_name AND name IN (:names)")
				.bind("guard_name", guardName).bind("names", names).map((row, meta) -> toModel(row)).all();
	}

	public Mono<Void> upsert(ReplicatedPermission permission) {
		return update(permission.id(), permission.name(), permission.guardName())
				.flatMap(updated -> updated > 0 ? Mono.empty()
						: db.sql("INSERT INTO permissions (id, name, guard_name) VALUES (:id, :name, :guard_name)")
								.bind("id", permission.id()).bind("name", permission.name())
								.bind("guard_name", permission.guardName()).fetch().rowsUpdated())
				.then();
	}

	public Mono<Long> update(long id, String name, String guardName) {
		StringBuilder sql = new StringBuilder("UPDATE permissions SET updated_at = CURRENT_TIMESTAMP");
		if (name != null) {
			sql.append(", name = :name");
		}
		if (guardName != null) {
			sql.append(", guard_name = :guard_name");
		}
		sql.append(" WHERE id = :id");

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString()).bind("id", id);
		if (name != null) {
			spec = spec.bind("name", name);
		}
		if (guardName != null) {
			spec = spec.bind("guard_name", guardName);
		}
		return spec.fetch().rowsUpdated();
	}

	public Mono<Long> delete(long id) {
		return db.sql("DELETE FROM permissions WHERE id = :id").bind("id", id).fetch().rowsUpdated();
	}

	private static ReplicatedPermission toModel(Row row) {
		return new ReplicatedPermission(row.get("id", Long.class), row.get("name", String.class),
				row.get("guard_name", String.class));
	}
}
