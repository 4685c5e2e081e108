package com.eainde.chesscoach.observability;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs latency, tool-call counts and token usage of every reasoning-model call. The job id is
 * already in the MDC of the calling thread.
 */
@Slf4j
public class ModelCallLoggingListener implements ChatModelListener {

    static final String START_TIME = "chess-coach.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
        log.debug("Sending {} messages to model", requestContext.chatRequest().messages().size());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        long duration = elapsed(responseContext.attributes().get(START_TIME));
        ChatResponse response = responseContext.chatResponse();
        TokenUsage usage = response.tokenUsage();
        int toolCalls = response.aiMessage().hasToolExecutionRequests()
                ? response.aiMessage().toolExecutionRequests().size() : 0;

        if (usage != null) {
            log.info("Model responded in {}ms with {} tool calls, tokens in={} out={} total={}",
                    duration, toolCalls, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.info("Model responded in {}ms with {} tool calls", duration, toolCalls);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("Model call failed after {}ms: {}",
                elapsed(errorContext.attributes().get(START_TIME)), errorContext.error().getMessage());
    }

    private static long elapsed(Object startTime) {
        return startTime instanceof Long start ? System.currentTimeMillis() - start : -1;
    }
}
