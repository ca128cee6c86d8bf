package com.rms.authsync.core.model;

/**
 * Local copy of an upstream user. {@code role} is the coarse {@code Admin}/{@code User} flag.
 */
public record ReplicatedUser(long id, String name, String email, String role) {

    public static final String ROLE_ADMIN = "Admin";
    public static final String ROLE_USER = "User";
}
