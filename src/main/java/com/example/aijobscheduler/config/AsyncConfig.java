package com.example.aijobscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for run supervision, in-process generation and async notifications.
 * <p>
 * Pools are bounded platform-thread pools. A cron tick only hands off to the
 * dispatch pool, so timers never block on a long run.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Supervises runs triggered by cron timers.
     * Rejects when the queue is full; the dispatcher drops the trigger and logs it.
     */
    @Bean(name = "jobDispatchExecutor")
    public ThreadPoolTaskExecutor jobDispatchExecutor(JobSchedulerProperties properties) {
        var execution = properties.getExecution();
        log.info("Creating job dispatch executor with {} threads and queue capacity {}",
                execution.getWorkerPoolSize(), execution.getQueueCapacity());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(execution.getWorkerPoolSize());
        executor.setMaxPoolSize(execution.getWorkerPoolSize());
        executor.setQueueCapacity(execution.getQueueCapacity());
        executor.setThreadNamePrefix("job-run-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }

    /**
     * Runs in-process generation calls so the supervisor can bound them with a timeout
     */
    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(JobSchedulerProperties properties) {
        var poolSize = properties.getExecution().getWorkerPoolSize();
        log.info("Creating generation executor with {} threads", poolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize);
        executor.setThreadNamePrefix("generation-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation (notifications).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring Spring TaskExecutor for async notifications");

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }
}
