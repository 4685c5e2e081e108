package com.eainde.chesscoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Coach agent and reasoning-model settings ({@code chess-coach.agent.*}).
 *
 * @param apiKey          Gemini API key
 * @param modelName       Gemini model name
 * @param temperature     sampling temperature
 * @param timeout         HTTP timeout of one model call
 * @param maxIterations   upper bound on model round-trips per lesson
 * @param maxAttempts     attempts per model call before the failure is surfaced
 * @param initialBackoff  delay after the first failed attempt; doubles per attempt
 * @param maxBackoff      ceiling for the backoff delay
 * @param logRequests     log raw model requests
 * @param logResponses    log raw model responses
 */
@ConfigurationProperties(prefix = "chess-coach.agent")
public record AgentProperties(
        String apiKey,
        String modelName,
        Double temperature,
        Duration timeout,
        Integer maxIterations,
        Integer maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Boolean logRequests,
        Boolean logResponses
) {

    public static final int DEFAULT_MAX_ITERATIONS = 30;

    public AgentProperties {
        modelName = modelName == null || modelName.isBlank() ? "gemini-2.5-flash" : modelName;
        temperature = temperature == null ? 0.4 : temperature;
        timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
        maxIterations = maxIterations == null ? DEFAULT_MAX_ITERATIONS : maxIterations;
        maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
        maxBackoff = maxBackoff == null ? Duration.ofSeconds(16) : maxBackoff;
        logRequests = logRequests != null && logRequests;
        logResponses = logResponses != null && logResponses;
        if (maxIterations < 1) {
            throw new IllegalArgumentException("chess-coach.agent.max-iterations must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("chess-coach.agent.max-attempts must be positive");
        }
    }

    /** Settings with every default applied, for wiring outside Spring. */
    public static AgentProperties defaults() {
        return new AgentProperties(null, null, null, null, null, null, null, null, null, null);
    }
}
