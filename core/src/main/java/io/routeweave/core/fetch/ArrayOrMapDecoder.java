package io.routeweave.core.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Decodes management API collections that arrive either as an array of
 * named objects or as an object keyed by name.
 *
 * <p>
 * The array shape is tried first. For the map shape, each key is injected
 * as the item's name unless the item already carries one.
 */
public final class ArrayOrMapDecoder {

    public static final String NAME_FIELD = "name";

    private ArrayOrMapDecoder() {
        // utility class
    }

    /**
     * Decodes a collection payload.
     *
     * @param payload the parsed endpoint body
     * @return the items, each a private copy, in payload order
     * @throws UpstreamDecodeException if the payload is neither shape
     */
    public static List<ObjectNode> decode(JsonNode payload) throws UpstreamDecodeException {
        List<ObjectNode> items = new ArrayList<>();
        if (payload == null || payload.isNull()) {
            return items;
        }

        if (payload.isArray()) {
            for (JsonNode element : payload) {
                if (!element.isObject()) {
                    throw new UpstreamDecodeException(
                            "Failed to parse as array or map: array element is " + element.getNodeType());
                }
                items.add(((ObjectNode) element).deepCopy());
            }
            return items;
        }

        if (payload.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isObject()) {
                    throw new UpstreamDecodeException("Failed to parse as array or map: value of '" + field.getKey()
                            + "' is " + field.getValue().getNodeType());
                }
                ObjectNode item = ((ObjectNode) field.getValue()).deepCopy();
                if (item.path(NAME_FIELD).asText("").isEmpty()) {
                    item.put(NAME_FIELD, field.getKey());
                }
                items.add(item);
            }
            return items;
        }

        throw new UpstreamDecodeException("Failed to parse as array or map: payload is " + payload.getNodeType());
    }
}
