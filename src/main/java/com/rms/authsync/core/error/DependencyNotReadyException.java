package com.rms.authsync.core.error;

/**
 * A referenced upstream entity (role, permission, user, store) has not been replicated yet.
 *
 * <p>Raised instead of creating the entity locally. The message is nak'd and converges once the
 * event that creates the dependency has been applied.</p>
 */
public class DependencyNotReadyException extends ReplicationException {

    public DependencyNotReadyException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
