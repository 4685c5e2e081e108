package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.config.AgentProperties;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Calls the reasoning model with bounded retries. The delay starts at {@code initialBackoff} and
 * doubles after every failed attempt, capped at {@code maxBackoff}.
 */
@Slf4j
@Component
public class ResilientModelCaller {

    /** Pause between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ChatModel chatModel;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    @Autowired
    public ResilientModelCaller(ChatModel chatModel, AgentProperties properties) {
        this(chatModel, properties.maxAttempts(), properties.initialBackoff(), properties.maxBackoff(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    public ResilientModelCaller(ChatModel chatModel, int maxAttempts, Duration initialBackoff,
                                Duration maxBackoff, Sleeper sleeper) {
        this.chatModel = chatModel;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    /**
     * @throws ModelCommunicationException once every attempt has failed
     */
    public ChatResponse call(ChatRequest request) {
        Duration backoff = initialBackoff;
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ChatResponse response = chatModel.chat(request);
                if (response == null || response.aiMessage() == null) {
                    throw new IllegalStateException("Model returned no message");
                }
                return response;
            } catch (RuntimeException e) {
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.warn("Model call attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, maxAttempts, rootCauseMessage(e), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ModelCommunicationException("Interrupted while waiting to retry the model call", ie);
                }
                backoff = backoff.multipliedBy(2).compareTo(maxBackoff) > 0 ? maxBackoff : backoff.multipliedBy(2);
            }
        }
        throw new ModelCommunicationException("Model call failed after " + maxAttempts + " attempts: "
                + rootCauseMessage(lastError), lastError);
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
