package com.acme.testkit.deprecations.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON decoding of deprecation metric maps produced by the collector.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {
    }

    /**
     * Reads {@code {"metric name": count, ...}} keeping the document's key order.
     *
     * @throws IllegalArgumentException when the document is not an object or a count is not an integer that fits a {@code long}
     */
    public static Map<String, Long> readMetrics(String raw) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(raw);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("deprecation counts must be a JSON object");
        }
        Map<String, Long> metrics = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (!node.isIntegralNumber()) {
                throw new IllegalArgumentException("non-integer count for metric: " + field.getKey());
            }
            if (!node.canConvertToLong()) {
                throw new IllegalArgumentException("count out of range for metric: " + field.getKey() + "=" + node.asText());
            }
            metrics.put(field.getKey(), node.longValue());
        }
        return metrics;
    }
}
