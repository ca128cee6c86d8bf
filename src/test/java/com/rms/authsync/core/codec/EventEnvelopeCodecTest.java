package com.rms.authsync.core.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.rms.authsync.core.error.UnparseableEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.jetstream.config.JacksonConfig;

class EventEnvelopeCodecTest {

    private final EventEnvelopeCodec codec = new EventEnvelopeCodec(new JacksonConfig().objectMapper());

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void decodesCompleteEnvelope() {
        EventEnvelope env = codec.decode(bytes("""
                {"id":"e-1","subject":"auth.v1.user.created","source":"auth-service",
                 "data":{"user":{"id":7,"email":"a@b.c"}}}
                """));

        assertEquals("e-1", env.id());
        assertEquals("auth.v1.user.created", env.subject());
        assertEquals("auth-service", env.source());
        assertEquals(7, env.data().path("user").path("id").asInt());
    }

    @Test
    void fallsBackToTypeWhenSubjectMissing() {
        EventEnvelope env = codec.decode(bytes("{\"id\":\"e-2\",\"type\":\"auth.v1.store.deleted\",\"data\":{}}"));

        assertEquals("auth.v1.store.deleted", env.subject());
    }

    @Test
    void missingDataBecomesEmptyObject() {
        EventEnvelope env = codec.decode(bytes("{\"id\":\"e-3\",\"subject\":\"auth.v1.role.deleted\",\"role_id\":4}"));

        assertTrue(env.data().isObject());
        assertEquals(0, env.data().size());
        assertEquals(4, env.document().path("role_id").asInt());
    }

    @Test
    void rejectsBodiesThatAreNotEnvelopes() {
        assertThrows(UnparseableEventException.class, () -> codec.decode(new byte[0]));
        assertThrows(UnparseableEventException.class, () -> codec.decode(bytes("{not json")));
        assertThrows(UnparseableEventException.class, () -> codec.decode(bytes("[1,2]")));
        assertThrows(UnparseableEventException.class, () -> codec.decode(bytes("{\"subject\":\"auth.v1.user.created\"}")));
        assertThrows(UnparseableEventException.class, () -> codec.decode(bytes("{\"id\":\"  \",\"subject\":\"x\"}")));
        assertThrows(UnparseableEventException.class, () -> codec.decode(bytes("{\"id\":\"e-4\"}")));
        assertThrows(UnparseableEventException.class, () -> codec.decode(bytes(
                "{\"id\":\"a\",\"subject\":\"auth.v1.store.deleted\",\"data\":{\"store_id\":1}} }garbage{")));
    }

    @Test
    void trailingContentAfterTheEnvelopeIsRejected() {
        UnparseableEventException e = assertThrows(UnparseableEventException.class, () -> codec.decode(bytes(
                "{\"id\":\"e-6\",\"subject\":\"auth.v1.store.deleted\",\"data\":{\"store_id\":1}} {\"id\":\"e-7\"}")));

        assertTrue(e.getMessage().startsWith("body is not valid JSON"));
    }

    @Test
    void encodeKeepsTheWholeDocument() {
        EventEnvelope env = codec.decode(bytes("{\"id\":\"e-5\",\"subject\":\"s\",\"extra\":true}"));

        String stored = codec.encode(env);

        assertTrue(stored.contains("\"extra\":true"));
        assertEquals("e-5", codec.decode(bytes(stored)).id());
    }
}
