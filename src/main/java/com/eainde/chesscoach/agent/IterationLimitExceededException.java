package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.error.ChessCoachException;

/** The coach loop used its whole iteration budget without producing a valid lesson. */
public class IterationLimitExceededException extends ChessCoachException {

    private final int iterations;

    public IterationLimitExceededException(int iterations) {
        super("No valid lesson after " + iterations + " model iterations");
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
