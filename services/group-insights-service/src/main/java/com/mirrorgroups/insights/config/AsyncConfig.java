package com.mirrorgroups.insights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the engine fan-out and for queued analysis jobs.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "insightExecutor")
    public ThreadPoolTaskExecutor insightExecutor(GroupInsightsProperties properties) {
        int threads = properties.getAnalysis().getEngineThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("insight-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Initialized insight executor with {} threads", threads);
        return executor;
    }

    @Bean(name = "analysisJobExecutor")
    public ThreadPoolTaskExecutor analysisJobExecutor(GroupInsightsProperties properties) {
        int slots = properties.getQueue().getMaxConcurrentJobs();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        executor.setQueueCapacity(slots);
        executor.setThreadNamePrefix("analysis-job-");
        executor.initialize();
        log.info("Initialized analysis job executor with {} slots", slots);
        return executor;
    }
}
