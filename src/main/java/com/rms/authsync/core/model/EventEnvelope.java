package com.rms.authsync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Decoded upstream event.
 *
 * <p>{@code data} is never null: a missing or null {@code data} member decodes to an empty object.
 * {@code document} is the full top-level object as received, kept so handlers can look for payloads
 * outside {@code data} and so the inbox can store the envelope verbatim.</p>
 *
 * @param id       upstream event id, unique across all subjects
 * @param subject  dotted event type, e.g. {@code auth.v1.user.created}
 * @param source   originating system name, may be null
 * @param data     subject specific payload
 * @param document the whole decoded envelope
 */
public record EventEnvelope(
        String id,
        String subject,
        String source,
        JsonNode data,
        ObjectNode document
) {
}
