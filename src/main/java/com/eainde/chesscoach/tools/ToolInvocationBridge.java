package com.eainde.chesscoach.tools;

import com.eainde.chesscoach.analysis.AnalysisCoordinator;
import com.eainde.chesscoach.chess.Board;
import com.eainde.chesscoach.chess.GameRecord;
import com.eainde.chesscoach.chess.PgnParser;
import com.eainde.chesscoach.lesson.AnnotationColor;
import com.eainde.chesscoach.lesson.AnnotationType;
import com.eainde.chesscoach.lesson.BoardAnnotation;
import com.eainde.chesscoach.lesson.Question;
import com.eainde.chesscoach.lesson.QuestionType;
import com.eainde.chesscoach.opening.OpeningClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs tool calls requested by the coach model against the analysis services.
 * <p>
 * {@link #dispatch} never throws: unknown tools, schema violations and handler failures (bad
 * FEN, illegal move, engine timeout) all come back as a failed {@link ToolResult} the model
 * can react to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolInvocationBridge {

    private final AnalysisCoordinator coordinator;
    private final OpeningClassifier openingClassifier;
    private final ToolCatalog catalog;
    private final ObjectMapper objectMapper;

    public List<ToolSpecification> specifications() {
        return catalog.specifications();
    }

    public ToolResult dispatch(ToolCall call) {
        long start = System.currentTimeMillis();
        try {
            ToolKind kind = ToolKind.fromName(call.name())
                    .orElseThrow(() -> new ToolDispatchException(
                            "Unknown tool '" + call.name() + "'. Available tools: " + ToolKind.names()));

            List<String> problems = ToolArgumentValidator.validate(catalog.schema(kind), call.arguments());
            if (!problems.isEmpty()) {
                throw new ToolDispatchException("Invalid arguments for " + kind.toolName() + ": " + String.join("; ", problems));
            }

            Object payload = invoke(kind, new Arguments(call.arguments()));
            log.debug("Tool {} ({}) succeeded in {}ms", kind.toolName(), call.id(), System.currentTimeMillis() - start);
            return ToolResult.success(call.id(), call.name(), objectMapper.valueToTree(payload));
        } catch (RuntimeException e) {
            log.warn("Tool {} ({}) failed after {}ms: {}", call.name(), call.id(), System.currentTimeMillis() - start, e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ToolResult.failure(call.id(), call.name(), message);
        }
    }

    /** Handler table; the switch is exhaustive over {@link ToolKind}. */
    private Object invoke(ToolKind kind, Arguments args) {
        return switch (kind) {
            case ANALYZE_POSITION -> coordinator.analyzePosition(args.text("fen"), args.integer("user_elo"));
            case ANALYZE_MOVE -> coordinator.analyzeMove(args.text("fen_before"), args.text("move"), args.integer("user_elo"));
            case CLASSIFY_OPENING -> classifyOpening(args.text("pgn"));
            case GET_POSITION_TYPE -> positionType(args.text("fen"));
            case CREATE_BOARD_ANNOTATION -> BoardAnnotation.create(
                    AnnotationType.fromLabel(args.text("annotation_type")),
                    AnnotationColor.fromLabel(args.text("color")),
                    args.text("from_square"),
                    args.text("to_square"),
                    args.text("square"));
            case CREATE_QUESTION -> Question.create(
                    QuestionType.fromLabel(args.text("question_type")),
                    args.text("question_text"),
                    args.textList("options"),
                    args.text("correct_answer"),
                    args.text("explanation"));
        };
    }

    private Object classifyOpening(String pgn) {
        GameRecord game = PgnParser.parse(pgn);
        return openingClassifier.classifyOrFallback(game.sanMoves());
    }

    private Map<String, Object> positionType(String fen) {
        Board board = Board.fromFen(fen);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("position_type", openingClassifier.positionType(board));
        result.put("fullmove_number", board.fullmoveNumber());
        result.put("piece_count", board.pieceCount());
        return result;
    }

    /** Typed access to arguments already checked against the schema. */
    private record Arguments(JsonNode node) {

        String text(String name) {
            JsonNode value = node.get(name);
            return value == null || value.isNull() ? null : value.asText();
        }

        int integer(String name) {
            return node.get(name).asInt();
        }

        List<String> textList(String name) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                return null;
            }
            List<String> items = new ArrayList<>();
            value.forEach(item -> items.add(item.asText()));
            return items;
        }
    }
}
