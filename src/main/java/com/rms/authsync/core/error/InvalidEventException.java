package com.rms.authsync.core.error;

/**
 * The event is structurally valid JSON but lacks a field the handler cannot do without
 * (e.g. a user id). No redelivery can fix it.
 */
public class InvalidEventException extends ReplicationException {

    public InvalidEventException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
