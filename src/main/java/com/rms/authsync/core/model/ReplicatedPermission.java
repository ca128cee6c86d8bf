package com.rms.authsync.core.model;

public record ReplicatedPermission(long id, String name, String guardName) {
}
