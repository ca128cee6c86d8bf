package com.rms.authsync.core.model;

/**
 * Outcome of asking the inbox whether an event id still needs to be applied.
 */
public enum Admission {

    /** No successful attempt recorded yet; the caller holds the row lock and must apply the event. */
    SHOULD_PROCESS,

    /** {@code processed_at} is already set; the event must be acknowledged without side effects. */
    ALREADY_DONE
}
