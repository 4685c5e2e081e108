package com.eainde.chesscoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Background lesson generation settings ({@code chess-coach.jobs.*}).
 *
 * @param workerThreads lessons generated concurrently
 * @param analysisThreads threads running engine fan-out for all jobs
 * @param defaultElo    rating assumed when a request carries none
 */
@ConfigurationProperties(prefix = "chess-coach.jobs")
public record JobProperties(Integer workerThreads, Integer analysisThreads, Integer defaultElo) {

    public JobProperties {
        workerThreads = workerThreads == null ? 4 : workerThreads;
        analysisThreads = analysisThreads == null ? 8 : analysisThreads;
        defaultElo = defaultElo == null ? 1500 : defaultElo;
    }
}
