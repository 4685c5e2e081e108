package com.eainde.chesscoach.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one {@link ToolCall}. Exactly one of {@code payload} and {@code errorMessage} is set.
 */
public record ToolResult(String callId, String toolName, boolean ok, JsonNode payload, String errorMessage) {

    public static ToolResult success(String callId, String toolName, JsonNode payload) {
        return new ToolResult(callId, toolName, true, payload, null);
    }

    public static ToolResult failure(String callId, String toolName, String errorMessage) {
        return new ToolResult(callId, toolName, false, null, errorMessage);
    }

    /** Text handed back to the model for this call. */
    public String toModelText() {
        return ok ? payload.toString() : "Error: " + errorMessage;
    }
}
