package com.eainde.chesscoach.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Argument schemas of every {@link ToolKind}, loaded once from the classpath, and the matching
 * langchain4j {@link ToolSpecification}s offered to the model.
 */
@Component
public class ToolCatalog {

    private final Map<ToolKind, JsonNode> schemas = new EnumMap<>(ToolKind.class);
    private final List<ToolSpecification> specifications;

    public ToolCatalog(ObjectMapper objectMapper) {
        for (ToolKind kind : ToolKind.values()) {
            schemas.put(kind, load(objectMapper, kind));
        }
        this.specifications = Arrays.stream(ToolKind.values())
                .map(kind -> ToolSpecification.builder()
                        .name(kind.toolName())
                        .description(schemas.get(kind).path("description").asText(kind.toolName()))
                        .parameters(ToolSchemaConverter.toParameters(schemas.get(kind)))
                        .build())
                .toList();
    }

    public JsonNode schema(ToolKind kind) {
        return schemas.get(kind);
    }

    public List<ToolSpecification> specifications() {
        return specifications;
    }

    private static JsonNode load(ObjectMapper objectMapper, ToolKind kind) {
        try (InputStream in = ToolCatalog.class.getResourceAsStream(kind.schemaResource())) {
            if (in == null) {
                throw new IllegalStateException("Schema " + kind.schemaResource() + " for tool " + kind.toolName() + " is missing");
            }
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema " + kind.schemaResource(), e);
        }
    }
}
