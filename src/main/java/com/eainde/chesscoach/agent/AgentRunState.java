package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.lesson.Lesson;

/**
 * State of one coach run. A run starts in {@code Running(0)}, moves to {@code Running(n + 1)}
 * after every tool round or rejected answer, and ends in {@link Succeeded} or {@link Failed}.
 */
public sealed interface AgentRunState {

    default boolean isTerminal() {
        return !(this instanceof Running);
    }

    /** @param iteration model round-trips completed so far */
    record Running(int iteration) implements AgentRunState {
    }

    record Succeeded(Lesson lesson, int iterations) implements AgentRunState {
    }

    record Failed(FailureReason reason, String message, int iterations) implements AgentRunState {
    }
}
