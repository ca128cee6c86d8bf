package com.rms.authsync.r2dbc.store;

import java.util.Collection;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.authsync.core.model.ReplicatedUser;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Replicated users plus their direct role and permission links.
 *
 * Every write is keyed by the upstream user id. Link writes assume the referenced rows exist;
 * callers check that first so a missing reference surfaces as a retryable condition rather than a
 * foreign key violation.
 */
@Repository
public class UserReplicaStore {

	private final DatabaseClient db;

	public UserReplicaStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<ReplicatedUser> findById(long id) {
		return db.sql("SELECT id, name, email, role FROM users WHERE id = :id").bind("id", id)
				.map((row, meta) -> new ReplicatedUser(row.get("id", Long.class), row.get("name", String.class),
						row.get("email", String.class), row.get("role", String.class)))
				.one();
	}

	public Mono<Boolean> exists(long id) {
		return db.sql("SELECT id FROM users WHERE id = :id").bind("id", id).map((row, meta) -> Boolean.TRUE).one()
				.defaultIfEmpty(Boolean.FALSE);
	}

	public Mono<Void> upsert(ReplicatedUser user) {
		String update = "UPDATE users SET name = :name, email = :email, role = :role, updated_at = CURRENT_TIMESTAMP "
				+ "WHERE id = :id";
		String insert = "INSERT INTO users (id, name, email, role) VALUES (:id, :name, :email, :role)";

		return db.sql(update).bind("name", user.name()).bind("email", user.email()).bind("role", user.role())
				.bind("id", user.id()).fetch().rowsUpdated()
				.flatMap(updated -> updated > 0 ? Mono.empty()
						: db.sql(insert).bind("id", user.id()).bind("name", user.name())
								.bind("email", user.email()).bind("role", user.role()).fetch().rowsUpdated())
				.then();
	}

	/**
	 * Applies whichever of {@code name}/{@code email} is non-null. Returns rows updated; 0 when the
	 * user is unknown or nothing was given.
	 */
	public Mono<Long> updateProfile(long id, String name, String email) {
		if (name == null && email == null) {
			return Mono.just(0L);
		}
		StringBuilder sql = new StringBuilder("UPDATE users SET updated_at = CURRENT_TIMESTAMP");
		if (name != null) {
			sql.append(", name = :name");
		}
		if (email != null) {
			sql.append(", email = :email");
		}
		sql.append(" WHERE id = :id");

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString()).bind("id", id);
		if (name != null) {
			spec = spec.bind("name", name);
		}
		if (email != null) {
			spec = spec.bind("email", email);
		}
		return spec.fetch().rowsUpdated();
	}

	public Mono<Long> updateRole(long id, String role) {
		return db.sql("UPDATE users SET role = :role, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
				.bind("role", role).bind("id", id).fetch().rowsUpdated();
	}

	public Mono<Long> delete(long id) {
		return db.sql("DELETE FROM users WHERE id = :id").bind("id", id).fetch().rowsUpdated();
	}

	// ---------------------------------------------------------------------
	// user_has_roles
	// ---------------------------------------------------------------------

	public Flux<String> roleNames(long userId) {
		return db.sql("SELECT r.name FROM user_has_roles ur JOIN roles r ON r.id = ur.role_id "
				+ "WHERE ur.user_id = :user_id ORDER BY r.name").bind("user_id", userId)
				.map((row, meta) -> row.get("name", String.class)).all();
	}

	public Mono<Void> attachRoles(long userId, Collection<Long> roleIds) {
		return Flux.fromIterable(roleIds)
				.concatMap(roleId -> db.sql("INSERT INTO user_has_roles (user_id, role_id) VALUES (:user_id, :role_id) "
						+ "ON CONFLICT DO NOTHING").bind("user_id", userId).bind("role_id", roleId).fetch().rowsUpdated())
				.then();
	}

	public Mono<Void> detachRoles(long userId, Collection<Long> roleIds) {
		if (roleIds.isEmpty()) {
			return Mono.empty();
		}
		return db.sql("DELETE FROM user_has_roles WHERE user_id = :user_id AND role_id IN (:role_ids)")
				.bind("user_id", userId).bind("role_ids", roleIds).fetch().rowsUpdated().then();
	}

	public Mono<Void> replaceRoles(long userId, Collection<Long> roleIds) {
		return db.sql("DELETE FROM user_has_roles WHERE user_id = :user_id").bind("user_id", userId).fetch()
				.rowsUpdated().then(attachRoles(userId, roleIds));
	}

	// ---------------------------------------------------------------------
	// user_has_permissions
	// ---------------------------------------------------------------------

	public Flux<String> permissionNames(long userId) {
		return db.sql("SELECT p.name FROM user_has_permissions up JOIN permissions p ON p.id = up.permission_id "
				+ "WHERE up.user_id = :user_id ORDER BY p.name").bind("user_id", userId)
				.map((row, meta) -> row.get("name", String.class)).all();
	}

	public Mono<Void> attachPermissions(long userId, Collection<Long> permissionIds) {
		return Flux.fromIterable(permissionIds)
				.concatMap(permissionId -> db.sql("INSERT INTO user_has_permissions (user_id, permission_id) "
						+ "VALUES (:user_id, :permission_id) ON CONFLICT DO NOTHING").bind("user_id", userId)
						.bind("permission_id", permissionId).fetch().rowsUpdated())
				.then();
	}

	public Mono<Void> detachPermissions(long userId, Collection<Long> permissionIds) {
		if (permissionIds.isEmpty()) {
			return Mono.empty();
		}
		return db.sql("DELETE FROM user_has_permissions WHERE user_id = :user_id AND permission_id IN (:permission_ids)")
				.bind("user_id", userId).bind("permission_ids", permissionIds).fetch().rowsUpdated().then();
	}

	public Mono<Void> replacePermissions(long userId, Collection<Long> permissionIds) {
		return db.sql("DELETE FROM user_has_permissions WHERE user_id = :user_id").bind("user_id", userId).fetch()
				.rowsUpdated().then(attachPermissions(userId, permissionIds));
	}
}
