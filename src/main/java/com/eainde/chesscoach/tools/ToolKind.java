package com.eainde.chesscoach.tools;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed catalog of tools the coach model may call. Adding or removing a constant changes
 * what the model can do and is a breaking change to the agent's contract.
 */
public enum ToolKind {
    ANALYZE_POSITION("analyze_position"),
    ANALYZE_MOVE("analyze_move"),
    CLASSIFY_OPENING("classify_opening"),
    GET_POSITION_TYPE("get_position_type"),
    CREATE_BOARD_ANNOTATION("create_board_annotation"),
    CREATE_QUESTION("create_question");

    private final String toolName;

    ToolKind(String toolName) {
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }

    /** Classpath location of the argument schema. */
    public String schemaResource() {
        return "/tools/" + toolName + ".json";
    }

    public static Optional<ToolKind> fromName(String name) {
        return Arrays.stream(values()).filter(kind -> kind.toolName.equals(name)).findFirst();
    }

    public static String names() {
        return Arrays.stream(values()).map(ToolKind::toolName).collect(Collectors.joining(", "));
    }
}
