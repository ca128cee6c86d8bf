package com.rms.authsync.core.error;

public class UnroutableEventException extends ReplicationException {

    private final String subject;

    public UnroutableEventException(String subject) {
        super("no handler for subject " + subject);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
