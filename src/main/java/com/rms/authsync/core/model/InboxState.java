package com.rms.authsync.core.model;

/**
 * Derived lifecycle state of an inbox row.
 *
 * <p>The table itself only stores timestamps and the last error. This enum is the vocabulary the
 * admin API uses to filter rows.</p>
 *
 * <ul>
 *   <li>{@link #PENDING}: seen, not applied, no failure recorded yet.</li>
 *   <li>{@link #FAILED}: seen, not applied, at least one failed attempt ({@code last_error} set).</li>
 *   <li>{@link #PARKED}: dead-lettered; acknowledged on the broker and never applied.</li>
 *   <li>{@link #PROCESSED}: applied exactly once; further deliveries are no-ops.</li>
 * </ul>
 */
public enum InboxState {
    PENDING,
    FAILED,
    PARKED,
    PROCESSED
}
