package com.streamfirst.ddns.adapters.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.ports.RecordSetFormatException;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON documents record sets are published as:
 *
 * <pre>{@code
 * {
 *   "domain": "example.eth",
 *   "records": {
 *     "A":   ["192.168.1.1", "192.168.1.2"],
 *     "TXT": "single value",
 *     "MX":  [{"preference": 10, "exchange": "mail.example.eth"}]
 *   },
 *   "ttl": 3600,
 *   "timestamp": 1700000000
 * }
 * }</pre>
 *
 * <p>A record may hold one value or an array of values. Object and array values are kept as
 * canonical JSON: compact, with object keys sorted, so the same structure always yields the same
 * string. Other scalars are kept as their text.
 */
public final class RecordSetJsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public RecordSet read(byte[] document) {
        JsonNode root;
        try {
            root = MAPPER.readTree(document);
        } catch (IOException e) {
            throw new RecordSetFormatException("Record set is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new RecordSetFormatException("Record set must be a JSON object");
        }
        JsonNode records = root.get("records");
        if (records == null || !records.isObject()) {
            throw new RecordSetFormatException("Record set has no \"records\" object");
        }

        RecordSet.RecordSetBuilder builder = RecordSet.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = records.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.record(field.getKey(), values(field.getValue()));
        }
        if (root.hasNonNull("domain")) {
            builder.domain(root.get("domain").asText());
        }
        JsonNode ttl = root.get("ttl");
        if (ttl != null && ttl.canConvertToInt()) {
            builder.ttl(ttl.intValue());
        }
        JsonNode timestamp = root.get("timestamp");
        if (timestamp != null && timestamp.canConvertToLong()) {
            builder.timestamp(Instant.ofEpochSecond(timestamp.longValue()));
        }
        return builder.build();
    }

    public byte[] write(RecordSet recordSet) {
        ObjectNode root = MAPPER.createObjectNode();
        if (recordSet.getDomain() != null) {
            root.put("domain", recordSet.getDomain());
        }
        ObjectNode records = root.putObject("records");
        recordSet.getRecords().forEach((type, values) -> {
            ArrayNode array = records.putArray(type);
            values.forEach(value -> array.add(parseStructured(value)));
        });
        if (recordSet.getTtl() != null) {
            root.put("ttl", recordSet.getTtl());
        }
        if (recordSet.getTimestamp() != null) {
            root.put("timestamp", recordSet.getTimestamp().getEpochSecond());
        }
        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new RecordSetFormatException("Failed to serialize record set", e);
        }
    }

    /**
     * Canonical string form of one record value.
     */
    public String canonicalize(JsonNode value) {
        if (value.isContainerNode()) {
            try {
                return MAPPER.writeValueAsString(MAPPER.treeToValue(value, Object.class));
            } catch (JsonProcessingException e) {
                throw new RecordSetFormatException("Failed to serialize record value", e);
            }
        }
        return value.asText();
    }

    private List<String> values(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(element -> {
                if (!element.isNull()) {
                    values.add(canonicalize(element));
                }
            });
        } else if (!node.isNull()) {
            values.add(canonicalize(node));
        }
        return values;
    }

    private JsonNode parseStructured(String value) {
        String trimmed = value.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return MAPPER.getNodeFactory().textNode(value);
        }
        try {
            return MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return MAPPER.getNodeFactory().textNode(value);
        }
    }
}
