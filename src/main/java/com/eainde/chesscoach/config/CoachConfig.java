package com.eainde.chesscoach.config;

import com.eainde.chesscoach.engine.EngineOracle;
import com.eainde.chesscoach.engine.EngineOraclePool;
import com.eainde.chesscoach.engine.UciEngineOracle;
import com.eainde.chesscoach.observability.ModelCallLoggingListener;
import com.eainde.chesscoach.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class CoachConfig {

    @Bean
    public ChatModel coachChatModel(AgentProperties agent) {
        if (agent.apiKey() == null || agent.apiKey().isBlank()) {
            throw new IllegalStateException("chess-coach.agent.api-key is not set; export GEMINI_API_KEY");
        }
        log.info("Coach model: {} (temperature {}, timeout {})", agent.modelName(), agent.temperature(), agent.timeout());
        return GoogleAiGeminiChatModel.builder()
                .apiKey(agent.apiKey())
                .modelName(agent.modelName())
                .temperature(agent.temperature())
                .timeout(agent.timeout())
                // retries are done by ResilientModelCaller
                .maxRetries(1)
                .logRequestsAndResponses(agent.logRequests() || agent.logResponses())
                .listeners(List.of(new ModelCallLoggingListener()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public EngineOraclePool engineOraclePool(EngineProperties engine) {
        List<EngineOracle> oracles = new ArrayList<>();
        for (int i = 0; i < engine.poolSize(); i++) {
            oracles.add(new UciEngineOracle("engine-" + (i + 1), engine.executable(), engine.threads(),
                    engine.hashMb(), engine.evaluationTimeout()));
        }
        log.info("Engine pool: {} x {} (threads {}, hash {}MB, objective depth {}, human-like depth {}..{})",
                engine.poolSize(), engine.executable(), engine.threads(), engine.hashMb(),
                engine.objectiveDepth(), engine.minDepth(), engine.maxDepth());
        return new EngineOraclePool(oracles, engine.checkoutTimeout());
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor analysisExecutor(JobProperties jobs) {
        return new MdcAwareExecutor("engine-fanout", jobs.analysisThreads());
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor lessonExecutor(JobProperties jobs) {
        return new MdcAwareExecutor("lesson-worker", jobs.workerThreads());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
