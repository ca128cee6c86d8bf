package com.rms.authsync.core.error;

/**
 * Message body is not a JSON object carrying a non-empty {@code id} and {@code subject}.
 */
public class UnparseableEventException extends ReplicationException {

    public UnparseableEventException(String message) {
        super(message);
    }

    public UnparseableEventException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
