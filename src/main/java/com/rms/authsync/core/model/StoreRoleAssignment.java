package com.rms.authsync.core.model;

/**
 * A user's role at one store, keyed by the upstream assignment id.
 *
 * @param storeId null when the assignment applies to every store of the user
 * @param meta    JSON object text, may be null
 */
public record StoreRoleAssignment(
        long id,
        long userId,
        Long storeId,
        String roleName,
        boolean active,
        String meta
) {
}
