package io.routeweave.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Conversions between JSON-valued text columns and Jackson trees. */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonColumns() {
        // utility class
    }

    /** Parses an object column; empty or null yields an empty object. */
    static JsonNode readObject(String column, String text) throws SQLException {
        if (text == null || text.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SQLException("Column " + column + " does not hold valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a string-to-string map column; empty or null yields an empty map. */
    static Map<String, String> readStringMap(String column, String text) throws SQLException {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(text, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new SQLException("Column " + column + " does not hold a JSON string map: " + e.getOriginalMessage(), e);
        }
    }

    static String write(JsonNode node) {
        return node == null || node.isMissingNode() ? "{}" : node.toString();
    }

    /** Serializes a header map; an empty map is stored as the empty string. */
    static String write(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return "";
        }
        try {
            return MAPPER.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize map: " + e.getOriginalMessage(), e);
        }
    }
}
