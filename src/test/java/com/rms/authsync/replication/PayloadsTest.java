package com.rms.authsync.replication;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.authsync.core.codec.EventEnvelopeCodec;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.jetstream.config.JacksonConfig;

class PayloadsTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();
    private final EventEnvelopeCodec codec = new EventEnvelopeCodec(mapper);

    private EventEnvelope envelope(String json) {
        return codec.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode json(String json) throws Exception {
        return mapper.readTree(json);
    }

    @Test
    void locatePrefersDataThenTopLevelThenPayload() {
        EventEnvelope all = envelope("""
                {"id":"1","subject":"s","data":{"user_id":1},"user_id":2,"payload":{"user_id":3}}
                """);
        EventEnvelope topAndPayload = envelope("""
                {"id":"1","subject":"s","data":{"user_id":null},"user_id":2,"payload":{"user_id":3}}
                """);
        EventEnvelope payloadOnly = envelope("""
                {"id":"1","subject":"s","payload":{"user_id":3}}
                """);

        assertEquals(1, Payloads.id(Payloads.locate(all, "user_id")));
        assertEquals(2, Payloads.id(Payloads.locate(topAndPayload, "user_id")));
        assertEquals(3, Payloads.id(Payloads.locate(payloadOnly, "user_id")));
        assertTrue(Payloads.locate(payloadOnly, "role_id").isMissingNode());
    }

    @Test
    void requireObjectRejectsScalars() {
        EventEnvelope env = envelope("{\"id\":\"1\",\"subject\":\"auth.v1.user.created\",\"data\":{\"user\":5}}");

        InvalidEventException e = assertThrows(InvalidEventException.class, () -> Payloads.requireObject(env, "user"));
        assertTrue(e.getMessage().contains("'user'"));
    }

    @Test
    void idAcceptsIntegralNumbersAndDigitStrings() throws Exception {
        assertEquals(12, Payloads.id(json("12")));
        assertEquals(12, Payloads.id(json("\"12\"")));
        assertEquals(12, Payloads.id(json("12.0")));
        assertEquals(0, Payloads.id(json("12.5")));
        assertEquals(0, Payloads.id(json("-3")));
        assertEquals(0, Payloads.id(json("\"abc\"")));
        assertEquals(0, Payloads.id(json("null")));
    }

    @Test
    void boolTreatsOnlyOneAsTrueAmongNumbers() throws Exception {
        assertEquals(Optional.of(true), Payloads.bool(json("true")));
        assertEquals(Optional.of(true), Payloads.bool(json("1")));
        assertEquals(Optional.of(false), Payloads.bool(json("0")));
        assertEquals(Optional.of(false), Payloads.bool(json("2")));
        assertEquals(Optional.of(false), Payloads.bool(json("\"false\"")));
        assertEquals(Optional.empty(), Payloads.bool(json("\"yes\"")));
        assertEquals(Optional.empty(), Payloads.bool(json("null")));
    }

    @Test
    void namesAreDistinctTrimmedStrings() throws Exception {
        assertEquals(List.of("a", "b"), Payloads.names(json("[\" a \", \"b\", \"a\", 3, \"\", null]")));
        assertEquals(List.of(), Payloads.names(json("\"a\"")));
    }

    @Test
    void changedValueToleratesBothDeltaShapes() throws Exception {
        JsonNode changed = json("""
                {"name":{"from":"Old","to":"New"},"email":"x@y.z","roles":["a"],"phone":{"from":"1","to":null}}
                """);

        assertEquals(Optional.of("New"), Payloads.changedValue(changed, "name"));
        assertEquals(Optional.of("x@y.z"), Payloads.changedValue(changed, "email"));
        assertEquals(Optional.empty(), Payloads.changedValue(changed, "roles"));
        assertEquals(Optional.empty(), Payloads.changedValue(changed, "phone"));
        assertEquals(Optional.empty(), Payloads.changedValue(changed, "missing"));
        assertTrue(Payloads.changedNode(changed, "roles").isArray());
    }

    @Test
    void groupNumberReadsFirstGroupLikeKey() throws Exception {
        assertEquals(12, Payloads.groupNumber(json("{\"region\":\"x\",\"Store_Group\":12,\"group\":3}"), mapper, 69));
        assertEquals(7, Payloads.groupNumber(json("{\"groupName\":\"north\",\"group_no\":\"7\"}"), mapper, 69));
        assertEquals(5, Payloads.groupNumber(json("\"{\\\"group\\\":5}\""), mapper, 69));
        assertEquals(69, Payloads.groupNumber(json("{\"group\":\"north\"}"), mapper, 69));
        assertEquals(69, Payloads.groupNumber(json("\"not json\""), mapper, 69));
        assertEquals(69, Payloads.groupNumber(json("null"), mapper, 69));
    }

    @Test
    void groupNumberCoercesNumericLookingValues() throws Exception {
        assertEquals(12, Payloads.groupNumber(json("{\"group\":12.0}"), mapper, 69));
        assertEquals(12, Payloads.groupNumber(json("{\"group\":\"12.0\"}"), mapper, 69));
        assertEquals(12, Payloads.groupNumber(json("{\"group\":12.9}"), mapper, 69));
        assertEquals(12, Payloads.groupNumber(json("{\"group\":\" 12 \"}"), mapper, 69));
        assertEquals(12, Payloads.groupNumber(json("{\"group\":12}"), mapper, 69));
        assertEquals(69, Payloads.groupNumber(json("{\"group\":\"\"}"), mapper, 69));
        assertEquals(69, Payloads.groupNumber(json("{\"group\":99999999999}"), mapper, 69));
        assertEquals(4, Payloads.groupNumber(json("\"{\\\"group\\\":4.0}\""), mapper, 69));
    }
}
