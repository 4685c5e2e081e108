package com.eainde.chesscoach.agent;

public enum FailureReason {
    ITERATION_LIMIT_EXCEEDED,
    MODEL_COMMUNICATION_ERROR,
    CANCELLED
}
