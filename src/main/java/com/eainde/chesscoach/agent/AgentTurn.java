package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.tools.ToolResult;
import dev.langchain4j.data.message.AiMessage;

import java.util.List;

/**
 * One completed model round-trip: what the model answered and what it was told back, either
 * the results of its tool calls or why its lesson was rejected.
 */
public record AgentTurn(int iteration, AiMessage response, List<ToolResult> toolResults, List<String> violations) {

    public AgentTurn {
        toolResults = List.copyOf(toolResults);
        violations = List.copyOf(violations);
    }

    public static AgentTurn toolRound(int iteration, AiMessage response, List<ToolResult> results) {
        return new AgentTurn(iteration, response, results, List.of());
    }

    public static AgentTurn rejectedAnswer(int iteration, AiMessage response, List<String> violations) {
        return new AgentTurn(iteration, response, List.of(), violations);
    }

    public boolean isToolRound() {
        return violations.isEmpty();
    }
}
