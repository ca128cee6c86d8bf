package com.rms.authsync.core.model;

import java.time.Instant;

/**
 * One row of the {@code event_inbox} ledger.
 *
 * <p>The first six components are known when a message is admitted. The remaining ones are
 * maintained by the gate and are null (or zero) on a freshly built record.</p>
 */
public record InboxRecord(
        String eventId,
        String subject,
        String source,
        String stream,
        String consumerName,
        String payload,
        Instant processedAt,
        String lastError,
        int attempts,
        Instant parkedAt,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Record for an event that has just been pulled and not yet written.
     */
    public static InboxRecord seen(EventEnvelope envelope, String stream, String consumerName, String payload) {
        return new InboxRecord(envelope.id(), envelope.subject(), envelope.source(), stream, consumerName, payload,
                null, null, 0, null, null, null);
    }

    public InboxState state() {
        if (processedAt != null) {
            return InboxState.PROCESSED;
        }
        if (parkedAt != null) {
            return InboxState.PARKED;
        }
        return lastError == null ? InboxState.PENDING : InboxState.FAILED;
    }
}
