package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.agent.AgentRunState.Failed;
import com.eainde.chesscoach.agent.AgentRunState.Succeeded;
import com.eainde.chesscoach.chess.PgnParser;
import com.eainde.chesscoach.lesson.Lesson;
import com.eainde.chesscoach.lesson.LessonFixtures;
import com.eainde.chesscoach.lesson.LessonStatus;
import com.eainde.chesscoach.tools.ToolCall;
import com.eainde.chesscoach.tools.ToolInvocationBridge;
import com.eainde.chesscoach.tools.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CoachAgentTest {

    private static final int MAX_ITERATIONS = 3;

    @Mock
    private ResilientModelCaller modelCaller;

    @Mock
    private ToolInvocationBridge bridge;

    private CoachAgent agent;
    private CoachRequest request;

    @BeforeEach
    void setUp() {
        lenient().when(bridge.specifications()).thenReturn(List.of());
        agent = new CoachAgent(modelCaller, bridge, new CoachPromptBuilder(), new ObjectMapper(), MAX_ITERATIONS);
        request = new CoachRequest("lesson-1", PgnParser.parse("1. e4 e5 2. Nf3"), 1500, List.of("openings"));
    }

    private static ChatResponse answer(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    private static ChatResponse toolCalls(ToolExecutionRequest... requests) {
        return ChatResponse.builder().aiMessage(AiMessage.from(requests)).build();
    }

    private static ToolExecutionRequest toolRequest(String id, String name, String arguments) {
        return ToolExecutionRequest.builder().id(id).name(name).arguments(arguments).build();
    }

    private List<ChatRequest> capturedRequests(int count) {
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(modelCaller, times(count)).call(captor.capture());
        return captor.getAllValues();
    }

    // ===== Successful runs =====

    @Nested
    @DisplayName("successful runs")
    class Successful {

        @Test
        @DisplayName("should accept a valid first answer")
        void firstAnswer() {
            when(modelCaller.call(any())).thenReturn(answer(LessonFixtures.validCommentsJson()));

            AgentRunState state = agent.run(request, () -> false);

            assertThat(state).isInstanceOf(Succeeded.class);
            Succeeded succeeded = (Succeeded) state;
            assertThat(succeeded.iterations()).isEqualTo(1);
            assertThat(succeeded.lesson().id()).isEqualTo("lesson-1");
            assertThat(succeeded.lesson().status()).isEqualTo(LessonStatus.COMPLETED);
            assertThat(succeeded.lesson().comments()).isEqualTo(LessonFixtures.validComments());
            assertThat(state.isTerminal()).isTrue();
        }

        @Test
        @DisplayName("should send prompts built from the game")
        void prompts() {
            when(modelCaller.call(any())).thenReturn(answer(LessonFixtures.validCommentsJson()));

            agent.run(request, () -> false);

            List<ChatMessage> messages = capturedRequests(1).get(0).messages();
            assertThat(messages).hasSize(2);
            assertThat(((SystemMessage) messages.get(0)).text()).contains("1500").contains("openings");
            assertThat(((UserMessage) messages.get(1)).singleText()).contains("2. 1...e5");
        }

        @Test
        @DisplayName("should send violations back and accept the corrected lesson")
        void correction() {
            when(modelCaller.call(any()))
                    .thenReturn(answer(LessonFixtures.twoCommentJson()))
                    .thenReturn(answer(LessonFixtures.validCommentsJson()));

            AgentRunState state = agent.run(request, () -> false);

            assertThat(state).isInstanceOf(Succeeded.class);
            assertThat(((Succeeded) state).iterations()).isEqualTo(2);
            List<ChatMessage> second = capturedRequests(2).get(1).messages();
            assertThat(second).hasSize(4);
            assertThat(second.get(2)).isInstanceOf(AiMessage.class);
            assertThat(((UserMessage) second.get(3)).singleText())
                    .startsWith("Your lesson was rejected.")
                    .contains("lesson must have between 3 and 5 comments, got 2");
        }

        @Test
        @DisplayName("should dispatch tool calls in order and return every result before the next call")
        void toolRound() {
            when(modelCaller.call(any()))
                    .thenReturn(toolCalls(
                            toolRequest("call-1", "classify_opening", "{\"pgn\": \"1. e4 e5\"}"),
                            toolRequest("call-2", "get_position_type", "{\"fen\": \"" + LessonFixtures.START + "\"}")))
                    .thenReturn(answer(LessonFixtures.validCommentsJson()));
            when(bridge.dispatch(any())).thenAnswer(inv -> {
                ToolCall call = inv.getArgument(0);
                return ToolResult.success(call.id(), call.name(), TextNode.valueOf("result of " + call.id()));
            });

            AgentRunState state = agent.run(request, () -> false);

            assertThat(((Succeeded) state).iterations()).isEqualTo(2);
            ArgumentCaptor<ToolCall> calls = ArgumentCaptor.forClass(ToolCall.class);
            InOrder order = inOrder(bridge, modelCaller);
            order.verify(modelCaller).call(any());
            order.verify(bridge, times(2)).dispatch(calls.capture());
            order.verify(modelCaller).call(any());
            assertThat(calls.getAllValues()).extracting(ToolCall::id).containsExactly("call-1", "call-2");

            List<ChatMessage> second = capturedRequests(2).get(1).messages();
            assertThat(second).hasSize(5);
            ToolExecutionResultMessage first = (ToolExecutionResultMessage) second.get(3);
            assertThat(first.id()).isEqualTo("call-1");
            assertThat(first.toolName()).isEqualTo("classify_opening");
            assertThat(first.text()).isEqualTo("\"result of call-1\"");
            assertThat(((ToolExecutionResultMessage) second.get(4)).id()).isEqualTo("call-2");
        }

        @Test
        @DisplayName("should pass unreadable tool arguments on as missing")
        void unreadableArguments() {
            when(modelCaller.call(any()))
                    .thenReturn(toolCalls(toolRequest("call-1", "get_position_type", "{fen: ")))
                    .thenReturn(answer(LessonFixtures.validCommentsJson()));
            when(bridge.dispatch(any())).thenReturn(ToolResult.failure("call-1", "get_position_type", "arguments must be a JSON object"));

            agent.run(request, () -> false);

            ArgumentCaptor<ToolCall> call = ArgumentCaptor.forClass(ToolCall.class);
            verify(bridge).dispatch(call.capture());
            assertThat(call.getValue().arguments()).isNull();
        }
    }

    // ===== Failed runs =====

    @Nested
    @DisplayName("failed runs")
    class Failing {

        @Test
        @DisplayName("should stop at the iteration ceiling")
        void iterationLimit() {
            when(modelCaller.call(any())).thenReturn(answer("I am not sure."));

            AgentRunState state = agent.run(request, () -> false);

            assertThat(state).isEqualTo(new Failed(FailureReason.ITERATION_LIMIT_EXCEEDED,
                    "No valid lesson after 3 model iterations", 3));
            verify(modelCaller, times(MAX_ITERATIONS)).call(any());
        }

        @Test
        @DisplayName("should fail when the model cannot be reached")
        void modelError() {
            when(modelCaller.call(any())).thenThrow(new ModelCommunicationException("Model call failed after 3 attempts: 503", null));

            AgentRunState state = agent.run(request, () -> false);

            assertThat(state).isInstanceOf(Failed.class);
            assertThat(((Failed) state).reason()).isEqualTo(FailureReason.MODEL_COMMUNICATION_ERROR);
            assertThat(((Failed) state).iterations()).isZero();
        }

        @Test
        @DisplayName("should not call the model once cancelled")
        void cancelledBeforeStart() {
            AgentRunState state = agent.run(request, () -> true);

            assertThat(((Failed) state).reason()).isEqualTo(FailureReason.CANCELLED);
            verifyNoInteractions(modelCaller);
        }

        @Test
        @DisplayName("should notice cancellation between iterations")
        void cancelledMidway() {
            AtomicInteger calls = new AtomicInteger();
            when(modelCaller.call(any())).thenAnswer(inv -> {
                calls.incrementAndGet();
                return answer("not yet");
            });

            AgentRunState state = agent.run(request, () -> calls.get() >= 1);

            assertThat(state).isEqualTo(new Failed(FailureReason.CANCELLED, "Lesson generation was cancelled", 1));
        }
    }

    // ===== generate =====

    @Test
    void generate_shouldReturnTheLessonOrThrow() {
        when(modelCaller.call(any())).thenReturn(answer(LessonFixtures.validCommentsJson()));

        Lesson lesson = agent.generate(request, () -> false);

        assertThat(lesson.comments()).hasSize(3);
        assertThatThrownBy(() -> agent.generate(request, () -> true)).isInstanceOf(CancellationException.class);
    }

    @Test
    void generate_shouldThrowWhenTheIterationsRunOut() {
        when(modelCaller.call(any())).thenReturn(answer("{}"));

        assertThatThrownBy(() -> agent.generate(request, () -> false))
                .isInstanceOf(IterationLimitExceededException.class)
                .satisfies(e -> assertThat(((IterationLimitExceededException) e).getIterations()).isEqualTo(3));
    }

    @Test
    void correctionMessage_shouldListEveryViolation() {
        assertThat(CoachAgent.correctionMessage(List.of("a", "b"))).endsWith("\n- a\n- b");
    }
}
