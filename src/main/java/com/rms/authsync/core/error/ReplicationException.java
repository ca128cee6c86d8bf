package com.rms.authsync.core.error;

/**
 * Base type for every failure raised while turning a broker message into read-model changes.
 *
 * <p>Subclasses decide how the message is settled on the broker. Anything that is not a
 * {@code ReplicationException} (driver errors, timeouts) is treated as transient.</p>
 */
public abstract class ReplicationException extends RuntimeException {

    protected ReplicationException(String message) {
        super(message);
    }

    protected ReplicationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return true when a later redelivery of the same message may succeed
     */
    public abstract boolean isRetryable();
}
