package com.rms.authsync.jetstream.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Read-model replication rules, bound from {@code authsync.replication}.
 */
@ConfigurationProperties(prefix = "authsync.replication")
public class ReplicationProperties {

    /** Guard used to resolve role and permission names that arrive without one. */
    private String guardName = "web";

    /** Role name that flips {@code users.role} to {@code Admin}. Compared case-insensitively. */
    private String adminRoleName = "Admin";

    /** Store group used when metadata carries no numeric group. */
    private int defaultStoreGroup = 69;

    /** Prefix for store-role assignments that arrive without a role name: {@code role_id_<n>}. */
    private String rolePlaceholderPrefix = "role_id_";

    /**
     * Role ids whose store-role removals and toggles are replicated. Empty means every role.
     */
    private List<Long> replicatedRoleIds = new ArrayList<>();

    public String getGuardName() {
        return guardName;
    }

    public void setGuardName(String guardName) {
        this.guardName = guardName;
    }

    public String getAdminRoleName() {
        return adminRoleName;
    }

    public void setAdminRoleName(String adminRoleName) {
        this.adminRoleName = adminRoleName;
    }

    public int getDefaultStoreGroup() {
        return defaultStoreGroup;
    }

    public void setDefaultStoreGroup(int defaultStoreGroup) {
        this.defaultStoreGroup = defaultStoreGroup;
    }

    public String getRolePlaceholderPrefix() {
        return rolePlaceholderPrefix;
    }

    public void setRolePlaceholderPrefix(String rolePlaceholderPrefix) {
        this.rolePlaceholderPrefix = rolePlaceholderPrefix;
    }

    public List<Long> getReplicatedRoleIds() {
        return replicatedRoleIds;
    }

    public void setReplicatedRoleIds(List<Long> replicatedRoleIds) {
        this.replicatedRoleIds = replicatedRoleIds;
    }

    public boolean isReplicatedRole(long roleId) {
        return replicatedRoleIds == null || replicatedRoleIds.isEmpty() || replicatedRoleIds.contains(roleId);
    }

    public String placeholderRoleName(long roleId) {
        return rolePlaceholderPrefix + roleId;
    }
}
