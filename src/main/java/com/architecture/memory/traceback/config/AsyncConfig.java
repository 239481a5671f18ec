package com.architecture.memory.traceback.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for retrieval fan-out and background code graph analysis.
 * Methods annotated with {@code @Async("analysisExecutor")} run on the analysis pool.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor(TracebackProperties properties) {
        int poolSize = Math.max(1, properties.getRetrieval().getPoolSize());
        log.info("[Async Config] Retrieval pool size: {}", poolSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("retrieval-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("codeql-");
        executor.initialize();
        return executor;
    }
}
