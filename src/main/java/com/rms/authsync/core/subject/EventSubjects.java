package com.rms.authsync.core.subject;

import java.util.List;

/**
 * Every subject this consumer knows how to replicate.
 *
 * <p>The router refuses to start unless each entry of {@link #ALL} has exactly one handler, so adding
 * a constant here without a handler fails fast.</p>
 */
public final class EventSubjects {

    private EventSubjects() {
    }

    public static final String USER_CREATED = "auth.v1.user.created";
    public static final String USER_UPDATED = "auth.v1.user.updated";
    public static final String USER_DELETED = "auth.v1.user.deleted";

    public static final String STORE_CREATED = "auth.v1.store.created";
    public static final String STORE_UPDATED = "auth.v1.store.updated";
    public static final String STORE_DELETED = "auth.v1.store.deleted";

    public static final String ROLE_CREATED = "auth.v1.role.created";
    public static final String ROLE_UPDATED = "auth.v1.role.updated";
    public static final String ROLE_DELETED = "auth.v1.role.deleted";

    public static final String PERMISSION_CREATED = "auth.v1.permission.created";
    public static final String PERMISSION_UPDATED = "auth.v1.permission.updated";
    public static final String PERMISSION_DELETED = "auth.v1.permission.deleted";

    public static final String ROLE_PERMISSION_ASSIGNED = "auth.v1.assignment.role_permission.assigned";
    public static final String ROLE_PERMISSION_REVOKED = "auth.v1.assignment.role_permission.revoked";
    public static final String ROLE_PERMISSION_SYNCED = "auth.v1.assignment.role_permission.synced";

    public static final String USER_ROLE_ASSIGNED = "auth.v1.user.role.assigned";
    public static final String USER_ROLE_REMOVED = "auth.v1.user.role.removed";
    public static final String USER_ROLE_SYNCED = "auth.v1.user.role.synced";

    public static final String USER_PERMISSION_GRANTED = "auth.v1.user.permission.granted";
    public static final String USER_PERMISSION_REVOKED = "auth.v1.user.permission.revoked";
    public static final String USER_PERMISSION_SYNCED = "auth.v1.user.permission.synced";

    public static final String USER_STORE_ROLE_ASSIGNED = "auth.v1.assignment.user_store_role.assigned";
    public static final String USER_STORE_ROLE_REMOVED = "auth.v1.assignment.user_store_role.removed";
    public static final String USER_STORE_ROLE_TOGGLED = "auth.v1.assignment.user_store_role.toggled";
    public static final String USER_STORE_ROLE_BULK_ASSIGNED = "auth.v1.assignment.user_store_role.bulk_assigned";

    public static final List<String> ALL = List.of(
            USER_CREATED, USER_UPDATED, USER_DELETED,
            STORE_CREATED, STORE_UPDATED, STORE_DELETED,
            ROLE_CREATED, ROLE_UPDATED, ROLE_DELETED,
            PERMISSION_CREATED, PERMISSION_UPDATED, PERMISSION_DELETED,
            ROLE_PERMISSION_ASSIGNED, ROLE_PERMISSION_REVOKED, ROLE_PERMISSION_SYNCED,
            USER_ROLE_ASSIGNED, USER_ROLE_REMOVED, USER_ROLE_SYNCED,
            USER_PERMISSION_GRANTED, USER_PERMISSION_REVOKED, USER_PERMISSION_SYNCED,
            USER_STORE_ROLE_ASSIGNED, USER_STORE_ROLE_REMOVED, USER_STORE_ROLE_TOGGLED,
            USER_STORE_ROLE_BULK_ASSIGNED
    );
}
