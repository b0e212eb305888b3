package com.ryuqq.ledger.adapter.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.ledger.core.event.ShipmentEvent;
import com.ryuqq.ledger.core.exception.CorruptRecordException;
import com.ryuqq.ledger.core.exception.StorageFailureException;
import com.ryuqq.ledger.core.model.EventId;
import com.ryuqq.ledger.core.model.EventType;
import com.ryuqq.ledger.core.model.Payload;
import com.ryuqq.ledger.core.model.Role;
import com.ryuqq.ledger.core.model.ShipmentId;
import com.ryuqq.ledger.core.spi.CounterRecord;
import com.ryuqq.ledger.core.statemachine.LifecycleState;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON line codec for event and counter records.
 *
 * <p><strong>Event record:</strong></p>
 * <pre>
 * {"event_id": "...", "shipment_id": "SHP-0000000001", "event_seq": 1,
 *  "event_type": "CREATED", "previous_state": null, "new_state": "CREATED",
 *  "emitting_role": "SENDER", "timestamp": "2024-01-15T09:00:00Z",
 *  "payload": {...}, "schema_version": 1}
 * </pre>
 *
 * <p>Unknown top-level fields are folded into the payload on read; an explicit payload
 * key wins over a folded one. A missing {@code schema_version} reads as 1. Timestamps
 * without an offset are taken as UTC.</p>
 *
 * <p><strong>Counter record:</strong> {@code {"counter": 1, "timestamp": "...", "action": "ID_GENERATED"}}</p>
 *
 * @author Ledger Team
 * @since 1.0.0
 */
final class JsonRecordCodec {

    static final String EVENT_ID = "event_id";
    static final String SHIPMENT_ID = "shipment_id";
    static final String EVENT_SEQ = "event_seq";
    static final String EVENT_TYPE = "event_type";
    static final String PREVIOUS_STATE = "previous_state";
    static final String NEW_STATE = "new_state";
    static final String EMITTING_ROLE = "emitting_role";
    static final String TIMESTAMP = "timestamp";
    static final String PAYLOAD = "payload";
    static final String SCHEMA_VERSION = "schema_version";

    static final String COUNTER = "counter";
    static final String ACTION = "action";

    private static final Set<String> EVENT_FIELDS = Set.of(
        EVENT_ID, SHIPMENT_ID, EVENT_SEQ, EVENT_TYPE, PREVIOUS_STATE, NEW_STATE,
        EMITTING_ROLE, TIMESTAMP, PAYLOAD, SCHEMA_VERSION
    );

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    JsonRecordCodec() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Encodes an event as a single JSON line (no newline).
     *
     * @throws StorageFailureException if the payload cannot be serialized
     */
    String encodeEvent(ShipmentEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put(EVENT_ID, event.eventId().getValue());
        node.put(SHIPMENT_ID, event.shipmentId().getValue());
        node.put(EVENT_SEQ, event.eventSeq());
        node.put(EVENT_TYPE, event.eventType().name());
        if (event.previousState() == null) {
            node.putNull(PREVIOUS_STATE);
        } else {
            node.put(PREVIOUS_STATE, event.previousState().name());
        }
        node.put(NEW_STATE, event.newState().name());
        node.put(EMITTING_ROLE, event.emittingRole().name());
        node.set(TIMESTAMP, mapper.valueToTree(event.timestamp()));
        node.set(PAYLOAD, mapper.valueToTree(event.payload().asMap()));
        node.put(SCHEMA_VERSION, event.schemaVersion());
        return write(node, "event " + event.eventId().getValue());
    }

    /**
     * Decodes one line into an event.
     *
     * @throws CorruptRecordException if the line is not a valid event record
     */
    ShipmentEvent decodeEvent(String line, long lineNumber) {
        JsonNode node = readObject(line, lineNumber);
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!EVENT_FIELDS.contains(field.getKey())) {
                    payload.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
                }
            }
            JsonNode payloadNode = node.get(PAYLOAD);
            if (payloadNode != null && !payloadNode.isNull()) {
                if (!payloadNode.isObject()) {
                    throw corrupt(lineNumber, "payload must be a JSON object", null);
                }
                payload.putAll(mapper.convertValue(payloadNode, MAP_TYPE));
            }

            JsonNode previous = node.get(PREVIOUS_STATE);
            JsonNode version = node.get(SCHEMA_VERSION);
            return new ShipmentEvent(
                EventId.of(text(node, EVENT_ID, lineNumber)),
                ShipmentId.of(text(node, SHIPMENT_ID, lineNumber)),
                number(node, EVENT_SEQ, lineNumber),
                EventType.valueOf(text(node, EVENT_TYPE, lineNumber)),
                previous == null || previous.isNull() ? null : LifecycleState.valueOf(previous.asText()),
                LifecycleState.valueOf(text(node, NEW_STATE, lineNumber)),
                Role.valueOf(text(node, EMITTING_ROLE, lineNumber)),
                instant(text(node, TIMESTAMP, lineNumber), lineNumber),
                Payload.of(payload),
                version == null || version.isNull() ? 1 : intNumber(node, SCHEMA_VERSION, lineNumber)
            );
        } catch (IllegalArgumentException e) {
            throw corrupt(lineNumber, e.getMessage(), e);
        }
    }

    String encodeCounter(CounterRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(COUNTER, record.counter());
        node.set(TIMESTAMP, mapper.valueToTree(record.timestamp()));
        node.put(ACTION, record.action());
        return write(node, "counter " + record.counter());
    }

    /**
     * Decodes one counter line.
     *
     * @throws CorruptRecordException if the line is not a valid counter record
     */
    CounterRecord decodeCounter(String line, long lineNumber) {
        JsonNode node = readObject(line, lineNumber);
        try {
            return new CounterRecord(
                number(node, COUNTER, lineNumber),
                instant(text(node, TIMESTAMP, lineNumber), lineNumber),
                node.hasNonNull(ACTION) ? node.get(ACTION).asText() : CounterRecord.ID_GENERATED
            );
        } catch (IllegalArgumentException e) {
            throw corrupt(lineNumber, e.getMessage(), e);
        }
    }

    private String write(ObjectNode node, String what) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Failed to serialize " + what, e);
        }
    }

    private JsonNode readObject(String line, long lineNumber) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw corrupt(lineNumber, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw corrupt(lineNumber, "record is not a JSON object", null);
        }
        return node;
    }

    private static String text(JsonNode node, String field, long lineNumber) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual()) {
            throw corrupt(lineNumber, "missing or non-text field '" + field + "'", null);
        }
        return value.asText();
    }

    private static long number(JsonNode node, String field, long lineNumber) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
            throw corrupt(lineNumber, "missing or non-integer field '" + field + "'", null);
        }
        return value.asLong();
    }

    private static int intNumber(JsonNode node, String field, long lineNumber) {
        long value = number(node, field, lineNumber);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw corrupt(lineNumber, "field '" + field + "' out of range: " + value, null);
        }
        return (int) value;
    }

    private static Instant instant(String value, long lineNumber) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw corrupt(lineNumber, "unparseable timestamp '" + value + "'", e);
            }
        }
    }

    private static CorruptRecordException corrupt(long lineNumber, String reason, Throwable cause) {
        return new CorruptRecordException("Line " + lineNumber + ": " + reason, lineNumber, cause);
    }
}
