package com.nevis.citation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Runs whole citation jobs and deep-analysis requests. A full queue rejects with
     * {@link org.springframework.core.task.TaskRejectedException} instead of blocking the submitter;
     * rejected jobs stay PENDING until the maintenance worker dispatches them again.
     */
    @Bean(name = "citationJobExecutor")
    public ThreadPoolTaskExecutor citationJobExecutor(
        @Value("${app.executor.jobs.concurrency:8}") int concurrency,
        @Value("${app.executor.jobs.queue-capacity:100}") int queueCapacity) {
        return boundedPool("citation-job-", concurrency, queueCapacity, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Per-element matcher calls fanned out by a running job. Kept apart from the job
     * executor so a job never waits on a slot held by itself. Overflow runs on the job thread.
     */
    @Bean(name = "citationMatchExecutor")
    public ThreadPoolTaskExecutor citationMatchExecutor(
        @Value("${app.executor.matches.concurrency:16}") int concurrency,
        @Value("${app.executor.matches.queue-capacity:200}") int queueCapacity) {
        return boundedPool("citation-match-", concurrency, queueCapacity, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    static ThreadPoolTaskExecutor boundedPool(String prefix, int concurrency, int queueCapacity,
                                              RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
