package com.rms.authsync.core.model;

public record ReplicatedStore(long id, String name, int groupNumber) {
}
