package com.fedivotes.infrastructure.config;

import com.fedivotes.infrastructure.context.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for the concurrent aggregate/ledger reads of one lookup.
 * Each read holds one pooled JDBC connection while it runs.
 */
@Configuration
public class AsyncConfig {

    public static final String VOTE_FETCH_EXECUTOR = "voteFetchExecutor";

    @Bean(name = VOTE_FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor voteFetchExecutor(AppProperties appProperties) {
        int poolSize = appProperties.getVotes().getFetchPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 32);
        executor.setThreadNamePrefix("vote-fetch-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
