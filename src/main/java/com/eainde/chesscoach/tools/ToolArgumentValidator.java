package com.eainde.chesscoach.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON schema the catalog uses: {@code required},
 * {@code type}, {@code enum}, {@code minimum}, {@code maximum} and array {@code items}.
 * Properties the schema does not declare are rejected.
 */
final class ToolArgumentValidator {

    private ToolArgumentValidator() {
    }

    static List<String> validate(JsonNode schema, JsonNode arguments) {
        List<String> problems = new ArrayList<>();
        if (arguments == null || !arguments.isObject()) {
            problems.add("arguments must be a JSON object");
            return problems;
        }
        JsonNode properties = schema.path("properties");
        for (JsonNode required : schema.path("required")) {
            JsonNode value = arguments.get(required.asText());
            if (value == null || value.isNull()) {
                problems.add("missing required argument '" + required.asText() + "'");
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode propertySchema = properties.get(field.getKey());
            if (propertySchema == null) {
                problems.add("unknown argument '" + field.getKey() + "'");
            } else if (!field.getValue().isNull()) {
                checkValue(field.getKey(), propertySchema, field.getValue(), problems);
            }
        }
        return problems;
    }

    private static void checkValue(String path, JsonNode schema, JsonNode value, List<String> problems) {
        String type = schema.path("type").asText("string");
        boolean typeOk = switch (type) {
            case "string" -> value.isTextual();
            case "integer" -> isInteger(value);
            case "number" -> value.isNumber();
            case "boolean" -> value.isBoolean();
            case "array" -> value.isArray();
            case "object" -> value.isObject();
            default -> true;
        };
        if (!typeOk) {
            problems.add("'" + path + "' must be of type " + type);
            return;
        }
        if (schema.has("enum")) {
            boolean allowed = false;
            for (JsonNode option : schema.get("enum")) {
                allowed |= option.asText().equals(value.asText());
            }
            if (!allowed) {
                problems.add("'" + path + "' must be one of " + schema.get("enum") + ", got '" + value.asText() + "'");
            }
        }
        if (value.isNumber()) {
            if (schema.has("minimum") && value.asDouble() < schema.get("minimum").asDouble()) {
                problems.add("'" + path + "' must be at least " + schema.get("minimum").asText());
            }
            if (schema.has("maximum") && value.asDouble() > schema.get("maximum").asDouble()) {
                problems.add("'" + path + "' must be at most " + schema.get("maximum").asText());
            }
        }
        if (value.isArray() && schema.has("items")) {
            for (int i = 0; i < value.size(); i++) {
                checkValue(path + "[" + i + "]", schema.get("items"), value.get(i), problems);
            }
        }
    }

    /** Models often send whole numbers as {@code 1500.0}; those count as integers. */
    private static boolean isInteger(JsonNode value) {
        return value.isIntegralNumber() || (value.isNumber() && value.asDouble() == Math.rint(value.asDouble()));
    }
}
