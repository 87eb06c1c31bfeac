package com.investbyyourself.etl.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    /**
     * Runs collectors. The orchestrator bounds how many run at once, so the pool only
     * needs to be at least that wide.
     */
    @Bean("collectorExecutor")
    public TaskExecutor collectorExecutor(EtlProperties properties) {
        int concurrency = Math.max(1, properties.getOrchestrator().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency * 2);
        executor.setQueueCapacity(100);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Collector-");
        executor.initialize();
        return executor;
    }

    @Bean("loaderExecutor")
    public TaskExecutor loaderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3); // one per backend kind
        executor.setMaxPoolSize(6);
        executor.setQueueCapacity(50);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Loader-");
        executor.initialize();
        return executor;
    }
}
