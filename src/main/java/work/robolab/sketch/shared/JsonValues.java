package work.robolab.sketch.shared;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Jackson trees into plain Java values (maps, lists, strings, numbers, booleans).
 */
public final class JsonValues {
    private JsonValues() {}

    public static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(toJava(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    public static Map<String, Object> toMap(JsonNode node) {
        var map = new LinkedHashMap<String, Object>();
        if (node == null || !node.isObject()) {
            return map;
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), toJava(entry.getValue()));
        }
        return map;
    }

    /**
     * Text of a scalar field, or {@code null} when the field is absent, null, blank or not a scalar.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) return null;
        var value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        var text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * A string or an array of strings as a list; anything else yields an empty list.
     */
    public static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        var values = new ArrayList<String>();
        if (node.isArray()) {
            for (var item : node) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }
}
