package com.eainde.chesscoach.tools;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts a JSON-schema document into langchain4j schema elements. Bounds ({@code minimum},
 * {@code maximum}) have no langchain4j counterpart and are appended to the description.
 */
final class ToolSchemaConverter {

    private ToolSchemaConverter() {
    }

    static JsonObjectSchema toParameters(JsonNode schema) {
        return parseObject(schema);
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            return JsonStringSchema.builder().description(description(node)).build();
        }

        return switch (node.get("type").asText()) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> parseString(node);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }
        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }
        if (node.has("required") && node.get("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> required.add(n.asText()));
            builder.required(required);
        }
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description(node));
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> values = new ArrayList<>();
            node.get("enum").forEach(n -> values.add(n.asText()));
            return JsonEnumSchema.builder().description(description(node)).enumValues(values).build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        String text = node.has("description") ? node.get("description").asText() : null;
        if (node.has("minimum") || node.has("maximum")) {
            String range = " (" + (node.has("minimum") ? node.get("minimum").asText() : "")
                    + ".." + (node.has("maximum") ? node.get("maximum").asText() : "") + ")";
            text = text == null ? range.strip() : text + range;
        }
        return text;
    }
}
