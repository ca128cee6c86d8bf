package com.rms.authsync.replication;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.model.EventEnvelope;

/**
 * Lenient readers for event payloads.
 *
 * <p>Producers have framed the same payload as {@code data.<x>}, a top-level {@code <x>} or
 * {@code payload.<x>}. Every lookup here tries those three locations in that order. Values of the
 * wrong type read as absent instead of raising; only the {@code require*} methods throw.</p>
 */
public final class Payloads {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);

    private Payloads() {
    }

    /**
     * First non-null value found for {@code field} at {@code data.field}, {@code field} or
     * {@code payload.field}. {@link MissingNode} when none.
     */
    public static JsonNode locate(EventEnvelope event, String field) {
        JsonNode[] candidates = {
                event.data().path(field),
                event.document().path(field),
                event.document().path("payload").path(field)
        };
        for (JsonNode candidate : candidates) {
            if (!candidate.isMissingNode() && !candidate.isNull()) {
                return candidate;
            }
        }
        return MissingNode.getInstance();
    }

    public static Optional<ObjectNode> object(EventEnvelope event, String entity) {
        JsonNode[] candidates = {
                event.data().path(entity),
                event.document().path(entity),
                event.document().path("payload").path(entity)
        };
        for (JsonNode candidate : candidates) {
            if (candidate.isObject()) {
                return Optional.of((ObjectNode) candidate);
            }
        }
        return Optional.empty();
    }

    public static ObjectNode requireObject(EventEnvelope event, String entity) {
        return object(event, entity).orElseThrow(() ->
                new InvalidEventException(event.subject() + ": missing '" + entity + "' object"));
    }

    /**
     * Positive identifier from an integral number or a digit-only string; 0 otherwise.
     */
    public static long id(JsonNode node) {
        if (node == null) {
            return 0L;
        }
        if (node.isIntegralNumber()) {
            return Math.max(node.asLong(), 0L);
        }
        if (node.isNumber()) {
            BigDecimal d = node.decimalValue();
            return d.stripTrailingZeros().scale() <= 0 ? Math.max(d.longValue(), 0L) : 0L;
        }
        if (node.isTextual()) {
            String v = node.asText().trim();
            if (INTEGER.matcher(v).matches()) {
                try {
                    return Math.max(Long.parseLong(v), 0L);
                } catch (NumberFormatException e) {
                    return 0L;
                }
            }
        }
        return 0L;
    }

    public static long requireId(EventEnvelope event, String field) {
        long id = id(locate(event, field));
        if (id <= 0) {
            throw new InvalidEventException(event.subject() + ": missing or invalid '" + field + "'");
        }
        return id;
    }

    public static long requireId(EventEnvelope event, JsonNode owner, String field) {
        long id = id(owner.path(field));
        if (id <= 0) {
            throw new InvalidEventException(event.subject() + ": missing or invalid '" + field + "'");
        }
        return id;
    }

    /**
     * Trimmed non-empty text of a scalar node. Numbers are rendered as text.
     */
    public static Optional<String> text(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return Optional.empty();
        }
        String v = node.asText().trim();
        return v.isEmpty() ? Optional.empty() : Optional.of(v);
    }

    /**
     * Boolean from {@code true}/{@code false}, a number (only {@code 1} is true) or the text form of
     * either. Empty for anything else.
     */
    public static Optional<Boolean> bool(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue().compareTo(BigDecimal.ONE) == 0);
        }
        if (node.isTextual()) {
            String v = node.asText().trim();
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            if (INTEGER.matcher(v).matches()) {
                return Optional.of(v.equals("1"));
            }
        }
        return Optional.empty();
    }

    /**
     * Distinct trimmed strings of an array, in order. Non-string elements and blanks are skipped;
     * a non-array node yields an empty list.
     */
    public static List<String> names(JsonNode node) {
        Set<String> out = new LinkedHashSet<>();
        if (node != null && node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual() && !element.asText().isBlank()) {
                    out.add(element.asText().trim());
                }
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * New scalar value of one changed field.
     *
     * <p>Accepts {@code {"from": a, "to": b}} and a bare scalar {@code b}. Arrays, objects and null
     * {@code to} values are ignored.</p>
     */
    public static Optional<String> changedValue(JsonNode changedFields, String field) {
        if (changedFields == null || !changedFields.isObject()) {
            return Optional.empty();
        }
        JsonNode change = changedFields.path(field);
        if (change.isObject()) {
            change = change.path("to");
        }
        return text(change);
    }

    /**
     * Raw {@code to} side of a changed field (or the bare value), including objects and arrays.
     */
    public static JsonNode changedNode(JsonNode changedFields, String field) {
        if (changedFields == null || !changedFields.isObject() || !changedFields.has(field)) {
            return MissingNode.getInstance();
        }
        JsonNode change = changedFields.path(field);
        if (change.isObject() && (change.has("to") || change.has("from"))) {
            return change.path("to");
        }
        return change;
    }

    /**
     * Store access group from free-form metadata.
     *
     * <p>Metadata may be an object or a JSON string holding one, parsed with {@code mapper}. The
     * first key, in document order, whose lower-cased name contains {@code group} and whose value is
     * numeric (a number or a numeric string) wins; fractions are truncated. Anything else yields
     * {@code fallback}.</p>
     */
    public static int groupNumber(JsonNode metadata, ObjectMapper mapper, int fallback) {
        JsonNode meta = metadata;
        if (meta != null && meta.isTextual()) {
            try {
                meta = mapper.readTree(meta.asText());
            } catch (JsonProcessingException e) {
                return fallback;
            }
        }
        if (meta == null || !meta.isObject()) {
            return fallback;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = meta.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getKey().toLowerCase(Locale.ROOT).contains("group")) {
                continue;
            }
            Optional<Integer> group = numeric(entry.getValue());
            if (group.isPresent()) {
                return group.get();
            }
        }
        return fallback;
    }

    private static Optional<Integer> numeric(JsonNode value) {
        BigDecimal d;
        if (value.isNumber()) {
            d = value.decimalValue();
        } else if (value.isTextual() && !value.asText().isBlank()) {
            try {
                d = new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (d.compareTo(INT_MAX) > 0 || d.compareTo(INT_MIN) < 0) {
            return Optional.empty();
        }
        return Optional.of(d.setScale(0, RoundingMode.DOWN).intValue());
    }
}
