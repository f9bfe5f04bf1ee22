package com.pandora.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools used by the skill runtime and the triggers.
 *
 * <ul>
 *   <li>{@code skillStepExecutor} runs independent steps of one skill in parallel.
 *       With {@code max-parallel-steps: 1} steps run on the calling thread, in topological order.</li>
 *   <li>{@code skillTriggerExecutor} runs whole skills for post-sync and on-demand triggers.</li>
 *   <li>{@code modelCallExecutor} bounds concurrent model calls and lets a step time out.</li>
 * </ul>
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "skillStepExecutor")
    public Executor skillStepExecutor(@Value("${pandora.skills.max-parallel-steps:1}") int maxParallelSteps) {
        if (maxParallelSteps <= 1) {
            return Runnable::run;
        }
        return Executors.newFixedThreadPool(maxParallelSteps, new CustomizableThreadFactory("skill-step-"));
    }

    @Bean(name = "skillTriggerExecutor", destroyMethod = "shutdown")
    public ExecutorService skillTriggerExecutor(@Value("${pandora.skills.trigger-pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("skill-trigger-"));
    }

    @Bean(name = "modelCallExecutor", destroyMethod = "shutdown")
    public ExecutorService modelCallExecutor(@Value("${pandora.skills.model-pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("model-call-"));
    }

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("pandora-cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
