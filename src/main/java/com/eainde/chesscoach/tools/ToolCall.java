package com.eainde.chesscoach.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool invocation requested by the model.
 *
 * @param id        call id assigned by the model, echoed back on the result
 * @param arguments parsed arguments; {@code null} when the model sent unreadable JSON
 */
public record ToolCall(String id, String name, JsonNode arguments) {
}
