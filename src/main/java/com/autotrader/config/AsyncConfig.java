package com.autotrader.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the monitoring loop and its side effects.
 *
 * <ul>
 *   <li>monitoringTaskScheduler: fires ticks on a fixed period</li>
 *   <li>tickExecutor: single thread that runs a tick so the scheduler never blocks</li>
 *   <li>monitoringExecutor: per-token work inside a tick, bounded by maxConcurrentChecks</li>
 *   <li>notificationExecutor / persistenceExecutor: fire-and-forget, drop on overflow</li>
 * </ul>
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    private static final int SIDE_EFFECT_QUEUE_CAPACITY = 1000;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskScheduler monitoringTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("monitor-tick-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "tickExecutor")
    public Executor tickExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        // A tick is only submitted after winning IDLE -> TICKING, so the queue never holds more than one
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("monitor-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Per-token workers within a tick. The tick waits for all of them, so running
     * on the caller when saturated is acceptable here.
     */
    @Bean(name = "monitoringExecutor")
    public Executor monitoringExecutor(MonitoringConfig monitoringConfig) {
        int threads = Math.max(1, monitoringConfig.getMaxConcurrentChecks());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("monitor-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Monitoring executor initialized: threads={}", threads);
        return executor;
    }

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        return sideEffectExecutor("notify-");
    }

    @Bean(name = "persistenceExecutor")
    public Executor persistenceExecutor() {
        return sideEffectExecutor("persist-");
    }

    private Executor sideEffectExecutor(String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(SIDE_EFFECT_QUEUE_CAPACITY);
        executor.setThreadNamePrefix(prefix);

        // Never block the monitoring thread: log and discard when full
        executor.setRejectedExecutionHandler(new DroppingRejectionHandler(prefix));

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Rejection handler that never runs the task on the caller.
     */
    private static class DroppingRejectionHandler implements RejectedExecutionHandler {

        private final String poolName;

        DroppingRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Task dropped by {} pool - queue full ({}/{})",
                    poolName, executor.getQueue().size(), SIDE_EFFECT_QUEUE_CAPACITY);
        }
    }
}
