package com.rms.authsync.replication.handler.assignment;

import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.replication.Payloads;

final class AssignmentIds {

    private AssignmentIds() {
    }

    /**
     * {@code assignment_id}, falling back to {@code assignment.id}; 0 when neither is a positive id.
     */
    static long of(EventEnvelope event) {
        long id = Payloads.id(Payloads.locate(event, "assignment_id"));
        if (id > 0) {
            return id;
        }
        return Payloads.object(event, "assignment")
                .map(a -> Payloads.id(a.path("id")))
                .orElse(0L);
    }
}
