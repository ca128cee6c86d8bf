package com.rms.authsync.replication;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.rms.authsync.core.error.DependencyNotReadyException;
import com.rms.authsync.core.model.ReplicatedPermission;
import com.rms.authsync.core.model.ReplicatedRole;
import com.rms.authsync.core.model.ReplicatedUser;
import com.rms.authsync.r2dbc.store.PermissionReplicaStore;
import com.rms.authsync.r2dbc.store.RoleReplicaStore;
import com.rms.authsync.r2dbc.store.StoreReplicaStore;
import com.rms.authsync.r2dbc.store.UserReplicaStore;

import reactor.core.publisher.Mono;

/**
 * Fail-closed lookups of referenced entities.
 *
 * <p>Every method either emits the referenced rows or errors with
 * {@link DependencyNotReadyException}. Name lookups are all-or-nothing: one unknown name fails the
 * whole call, so a grant never applies half of its list.</p>
 */
@Component
public class ReferenceResolver {

    private final UserReplicaStore users;
    private final StoreReplicaStore stores;
    private final RoleReplicaStore roles;
    private final PermissionReplicaStore permissions;

    public ReferenceResolver(UserReplicaStore users, StoreReplicaStore stores, RoleReplicaStore roles,
                             PermissionReplicaStore permissions) {
        this.users = users;
        this.stores = stores;
        this.roles = roles;
        this.permissions = permissions;
    }

    public Mono<ReplicatedUser> requireUser(long userId) {
        return users.findById(userId)
                .switchIfEmpty(Mono.error(() -> new DependencyNotReadyException("User " + userId + " not found")));
    }

    public Mono<Void> requireStore(long storeId) {
        return stores.exists(storeId)
                .flatMap(exists -> exists ? Mono.<Void>empty()
                        : Mono.error(new DependencyNotReadyException("Store " + storeId + " not found")));
    }

    public Mono<ReplicatedRole> requireRole(long roleId) {
        return roles.findById(roleId)
                .switchIfEmpty(Mono.error(() -> new DependencyNotReadyException("Role " + roleId + " not found")));
    }

    /**
     * @return role ids in the order of {@code names}
     */
    public Mono<List<Long>> requireRoleIds(Collection<String> names, String guardName) {
        return roles.findByNames(names, guardName)
                .collectMap(ReplicatedRole::name, ReplicatedRole::id)
                .map(found -> orderedIds(names, found, "Role", guardName));
    }

    /**
     * @return permission ids in the order of {@code names}
     */
    public Mono<List<Long>> requirePermissionIds(Collection<String> names, String guardName) {
        return permissions.findByNames(names, guardName)
                .collectMap(ReplicatedPermission::name, ReplicatedPermission::id)
                .map(found -> orderedIds(names, found, "Permission", guardName));
    }

    /**
     * Ids of those {@code names} that exist; unknown names are skipped. Used by revocations where
     * a missing permission simply has nothing to detach.
     */
    public Mono<List<Long>> existingPermissionIds(Collection<String> names, String guardName) {
        return permissions.findByNames(names, guardName)
                .map(ReplicatedPermission::id)
                .collectList();
    }

    private static List<Long> orderedIds(Collection<String> names, Map<String, Long> found, String kind,
                                         String guardName) {
        List<String> missing = names.stream()
                .filter(name -> !found.containsKey(name))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new DependencyNotReadyException(kind + (missing.size() == 1 ? " '" + missing.get(0) + "'" : "s " + missing)
                    + " not found for guard " + guardName);
        }
        List<Long> ids = new ArrayList<>(names.size());
        names.forEach(name -> ids.add(found.get(name)));
        return ids;
    }
}
