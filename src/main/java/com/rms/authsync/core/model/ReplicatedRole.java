package com.rms.authsync.core.model;

public record ReplicatedRole(long id, String name, String guardName) {
}
