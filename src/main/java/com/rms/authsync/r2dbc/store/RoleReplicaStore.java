package com.rms.authsync.r2dbc.store;

import java.util.Collection;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.authsync.core.model.ReplicatedRole;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Replicated roles and the {@code role_has_permissions} link table.
 */
@Repository
public class RoleReplicaStore {

	private final DatabaseClient db;

	public RoleReplicaStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<ReplicatedRole> findById(long id) {
		return db.sql("SELECT id, name, guard_name FROM roles WHERE id = :id").bind("id", id)
				.map((row, meta) -> toModel(row)).one();
	}

	public Flux<ReplicatedRole> findByNames(Collection<String> names, String guardName) {
		if (names.isEmpty()) {
			return Flux.empty();
		}
		return db.sql("SELECT id, name, guard_name FROM roles WHERE guard_name = :guard_name AND name IN (:names)")
				.bind("guard_name", guardName).bind("names", names).map((row, meta) -> toModel(row)).all();
	}

	public Mono<Void> upsert(ReplicatedRole role) {
		return update(role.id(), role.name(), role.guardName())
				.flatMap(updated -> updated > 0 ? Mono.empty()
						: db.sql("INSERT INTO roles (id, name, guard_name) VALUES (:id, :name, :guard_name)")
								.bind("id", role.id()).bind("name", role.name())
								.bind("guard_name", role.guardName()).fetch().rowsUpdated())
				.then();
	}

	public Mono<Long> update(long id, String name, String guardName) {
		StringBuilder sql = new StringBuilder("UPDATE roles SET updated_at = CURRENT_TIMESTAMP");
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
		return db.sql("DELETE FROM roles WHERE id = :id").bind("id", id).fetch().rowsUpdated();
	}

	// ---------------------------------------------------------------------
	// role_has_permissions
	// ---------------------------------------------------------------------

	public Flux<String> permissionNames(long roleId) {
		return db.sql("SELECT p.name FROM role_has_permissions rp JOIN permissions p ON p.id = rp.permission_id "
				+ "WHERE rp.role_id = :role_id ORDER BY p.name").bind("role_id", roleId)
				.map((row, meta) -> row.get("name", String.class)).all();
	}

	public Mono<Void> attachPermissions(long roleId, Collection<Long> permissionIds) {
		return Flux.fromIterable(permissionIds)
				.concatMap(permissionId -> db.sql("INSERT INTO role_has_permissions (role_id, permission_id) "
						+ "VALUES (:role_id, :permission_id) ON CONFLICT DO NOTHING").bind("role_id", roleId)
						.bind("permission_id", permissionId).fetch().rowsUpdated())
				.then();
	}

	public Mono<Void> detachPermissions(long roleId, Collection<Long> permissionIds) {
		if (permissionIds.isEmpty()) {
			return Mono.empty();
		}
		return db.sql("DELETE FROM role_has_permissions WHERE role_id = :role_id AND permission_id IN (:permission_ids)")
				.bind("role_id", roleId).bind("permission_ids", permissionIds).fetch().rowsUpdated().then();
	}

	public Mono<Void> replacePermissions(long roleId, Collection<Long> permissionIds) {
		return db.sql("DELETE FROM role_has_permissions WHERE role_id = :role_id").bind("role_id", roleId).fetch()
				.rowsUpdated().then(attachPermissions(roleId, permissionIds));
	}

	private static ReplicatedRole toModel(Row row) {
		return new ReplicatedRole(row.get("id", Long.class), row.get("name", String.class),
				row.get("guard_name", String.class));
	}
}
