package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.agent.AgentRunState.Failed;
import com.eainde.chesscoach.agent.AgentRunState.Running;
import com.eainde.chesscoach.agent.AgentRunState.Succeeded;
import com.eainde.chesscoach.config.AgentProperties;
import com.eainde.chesscoach.error.ValidationException;
import com.eainde.chesscoach.lesson.Lesson;
import com.eainde.chesscoach.lesson.LessonComment;
import com.eainde.chesscoach.lesson.LessonPayloadParser;
import com.eainde.chesscoach.lesson.LessonStatus;
import com.eainde.chesscoach.lesson.LessonValidator;
import com.eainde.chesscoach.tools.ToolCall;
import com.eainde.chesscoach.tools.ToolInvocationBridge;
import com.eainde.chesscoach.tools.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * The bounded tool-calling loop that turns a game into a lesson.
 * <p>
 * Each call to {@link #step} is one transition of {@link AgentRunState}: the model sees the
 * prompts plus the whole history and the tool catalog, then either asks for tools (all results
 * are appended before the next call) or answers with a lesson. A rejected lesson is sent back
 * with its violations and costs an iteration like a tool round. The run ends at the first valid
 * lesson, at the iteration ceiling, or when the model cannot be reached.
 */
@Slf4j
@Component
public class CoachAgent {

    private final ResilientModelCaller modelCaller;
    private final ToolInvocationBridge bridge;
    private final CoachPromptBuilder prompts;
    private final ObjectMapper objectMapper;
    private final int maxIterations;

    @Autowired
    public CoachAgent(ResilientModelCaller modelCaller, ToolInvocationBridge bridge, CoachPromptBuilder prompts,
                      ObjectMapper objectMapper, AgentProperties properties) {
        this(modelCaller, bridge, prompts, objectMapper, properties.maxIterations());
    }

    public CoachAgent(ResilientModelCaller modelCaller, ToolInvocationBridge bridge, CoachPromptBuilder prompts,
                      ObjectMapper objectMapper, int maxIterations) {
        this.modelCaller = modelCaller;
        this.bridge = bridge;
        this.prompts = prompts;
        this.objectMapper = objectMapper;
        this.maxIterations = maxIterations;
    }

    /**
     * Runs the loop to a terminal state. {@code cancelled} is checked before every iteration.
     */
    public AgentRunState run(CoachRequest request, BooleanSupplier cancelled) {
        Conversation conversation = new Conversation(prompts.systemPrompt(request), prompts.userPrompt(request));
        AgentRunState state = new Running(0);
        while (state instanceof Running running) {
            if (cancelled.getAsBoolean()) {
                log.info("Lesson {} cancelled after {} iterations", request.lessonId(), running.iteration());
                return new Failed(FailureReason.CANCELLED, "Lesson generation was cancelled", running.iteration());
            }
            state = step(request, conversation, running);
        }
        return state;
    }

    /**
     * Runs the loop and unwraps the outcome.
     *
     * @throws IterationLimitExceededException if no valid lesson arrived in time
     * @throws ModelCommunicationException     if the model could not be reached
     * @throws CancellationException           if {@code cancelled} turned true
     */
    public Lesson generate(CoachRequest request, BooleanSupplier cancelled) {
        AgentRunState state = run(request, cancelled);
        if (state instanceof Succeeded succeeded) {
            return succeeded.lesson();
        }
        Failed failed = (Failed) state;
        switch (failed.reason()) {
            case ITERATION_LIMIT_EXCEEDED -> throw new IterationLimitExceededException(failed.iterations());
            case MODEL_COMMUNICATION_ERROR -> throw new ModelCommunicationException(failed.message(), null);
            case CANCELLED -> throw new CancellationException(failed.message());
        }
        throw new IllegalStateException("Unhandled failure " + failed.reason());
    }

    /** One transition out of {@code Running(n)}. */
    AgentRunState step(CoachRequest request, Conversation conversation, Running running) {
        int iteration = running.iteration();
        if (iteration >= maxIterations) {
            log.warn("Lesson {} hit the iteration limit of {}", request.lessonId(), maxIterations);
            return new Failed(FailureReason.ITERATION_LIMIT_EXCEEDED,
                    "No valid lesson after " + maxIterations + " model iterations", iteration);
        }

        AiMessage response;
        try {
            response = modelCaller.call(ChatRequest.builder()
                    .messages(conversation.messages())
                    .toolSpecifications(bridge.specifications())
                    .build()).aiMessage();
        } catch (ModelCommunicationException e) {
            log.error("Lesson {} failed talking to the model: {}", request.lessonId(), e.getMessage());
            return new Failed(FailureReason.MODEL_COMMUNICATION_ERROR, e.getMessage(), iteration);
        }

        if (response.hasToolExecutionRequests()) {
            List<ToolResult> results = new ArrayList<>();
            for (ToolExecutionRequest toolRequest : response.toolExecutionRequests()) {
                results.add(bridge.dispatch(toToolCall(toolRequest)));
            }
            log.debug("Iteration {}: {} tool calls", iteration, results.size());
            conversation.append(AgentTurn.toolRound(iteration, response, results));
            return new Running(iteration + 1);
        }

        List<String> violations;
        List<LessonComment> comments = null;
        try {
            comments = LessonPayloadParser.parse(response.text());
            violations = LessonValidator.validate(comments);
        } catch (ValidationException e) {
            violations = List.of(e.getMessage());
        }
        if (violations.isEmpty()) {
            log.info("Lesson {} accepted after {} iterations with {} steps",
                    request.lessonId(), iteration + 1, comments.size());
            return new Succeeded(new Lesson(request.lessonId(), comments, LessonStatus.COMPLETED), iteration + 1);
        }
        log.info("Iteration {}: lesson rejected with {} violations", iteration, violations.size());
        conversation.append(AgentTurn.rejectedAnswer(iteration, response, violations));
        return new Running(iteration + 1);
    }

    private ToolCall toToolCall(ToolExecutionRequest request) {
        JsonNode arguments;
        try {
            String raw = request.arguments();
            arguments = objectMapper.readTree(raw == null || raw.isBlank() ? "{}" : raw);
        } catch (JsonProcessingException e) {
            arguments = null;
        }
        return new ToolCall(request.id(), request.name(), arguments);
    }

    static String correctionMessage(List<String> violations) {
        return "Your lesson was rejected. Fix these problems and answer again with the complete JSON object:\n- "
                + String.join("\n- ", violations);
    }

    /** Append-only history of one run; chat messages are derived from it. */
    static final class Conversation {

        private final String systemPrompt;
        private final String userPrompt;
        private final List<AgentTurn> history = new ArrayList<>();

        Conversation(String systemPrompt, String userPrompt) {
            this.systemPrompt = systemPrompt;
            this.userPrompt = userPrompt;
        }

        void append(AgentTurn turn) {
            history.add(turn);
        }

        List<ChatMessage> messages() {
            List<ChatMessage> messages = new ArrayList<>();
            messages.add(SystemMessage.from(systemPrompt));
            messages.add(UserMessage.from(userPrompt));
            for (AgentTurn turn : history) {
                messages.add(turn.response());
                if (turn.isToolRound()) {
                    for (ToolResult result : turn.toolResults()) {
                        messages.add(ToolExecutionResultMessage.from(result.callId(), result.toolName(), result.toModelText()));
                    }
                } else {
                    messages.add(UserMessage.from(correctionMessage(turn.violations())));
                }
            }
            return messages;
        }
    }
}
