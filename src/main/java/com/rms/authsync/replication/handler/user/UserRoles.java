package com.rms.authsync.replication.handler.user;

import java.util.Collection;

/**
 * Helpers for the coarse {@code users.role} flag.
 */
final class UserRoles {

    private UserRoles() {
    }

    static boolean containsAdmin(Collection<String> roleNames, String adminRoleName) {
        return roleNames.stream().anyMatch(name -> name.equalsIgnoreCase(adminRoleName));
    }
}
