package com.rms.authsync.consumer;

/**
 * How a pulled message was settled.
 */
public enum Disposition {

    /** Handler ran and the inbox row was marked processed; acked. */
    APPLIED,

    /** Already processed by an earlier delivery; acked without running the handler. */
    DUPLICATE,

    /** Body could not be decoded into an envelope; acked and dropped. */
    DISCARDED,

    /** No handler for the subject; acked and dropped. */
    UNROUTABLE,

    /** Dead-lettered in the inbox; acked. */
    PARKED,

    /** Attempt failed and was recorded; nak'd for redelivery. */
    RETRY
}
