package com.rms.authsync.core.codec;

import java.io.IOException;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.error.UnparseableEventException;
import com.rms.authsync.core.model.EventEnvelope;

/**
 * Decodes raw message bodies into {@link EventEnvelope}s.
 *
 * Either a complete envelope comes back or an {@link UnparseableEventException} is thrown; there is
 * no partially decoded result. When {@code subject} is absent the top-level {@code type} member is
 * used instead, since some producers only fill that one.
 */
@Component
public class EventEnvelopeCodec {

	private final ObjectMapper mapper;
	private final ObjectReader reader;

	public EventEnvelopeCodec(ObjectMapper mapper) {
		this.mapper = mapper;
		this.reader = mapper.readerFor(JsonNode.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
	}

	public EventEnvelope decode(byte[] body) {
		if (body == null || body.length == 0) {
			throw new UnparseableEventException("empty body");
		}

		JsonNode root;
		try {
			root = reader.readTree(body);
		} catch (JsonProcessingException e) {
			throw new UnparseableEventException("body is not valid JSON: " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new UnparseableEventException("body could not be read: " + e.getMessage(), e);
		}

		if (root == null || !root.isObject()) {
			throw new UnparseableEventException("top level is not a JSON object");
		}
		ObjectNode document = (ObjectNode) root;

		String id = nonEmptyText(document.get("id"));
		if (id == null) {
			throw new UnparseableEventException("missing id");
		}

		String subject = nonEmptyText(document.get("subject"));
		if (subject == null) {
			subject = nonEmptyText(document.get("type"));
		}
		if (subject == null) {
			throw new UnparseableEventException("missing subject");
		}

		JsonNode data = document.get("data");
		if (data == null || data.isNull()) {
			data = mapper.createObjectNode();
		}

		return new EventEnvelope(id, subject, nonEmptyText(document.get("source")), data, document);
	}

	/**
	 * Renders the envelope for storage in the inbox {@code payload} column.
	 */
	public String encode(EventEnvelope envelope) {
		try {
			return mapper.writeValueAsString(envelope.document());
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize event " + envelope.id(), e);
		}
	}

	private static String nonEmptyText(JsonNode node) {
		if (node == null || !node.isTextual()) {
			return null;
		}
		String v = node.asText().trim();
		return v.isEmpty() ? null : v;
	}
}
