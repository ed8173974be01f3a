package com.phillippitts.engramdesk.config;

import com.phillippitts.engramdesk.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools owned by the sidecar supervisor. Both are tied to the application context,
 * so shutdown abandons sleeping background tasks deterministically instead of leaving them
 * to process exit.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Task group for output monitors and grace-period confirmations.
     *
     * <p>Pool sizing configured via {@code threadpool.sidecar.*}:
     * <ul>
     *   <li>Core pool: default 2 - one monitor and one grace task for the live worker</li>
     *   <li>Max pool: default 16 - headroom for monitors of released handles still draining</li>
     *   <li>Queue: default 0 - a monitor must never wait behind another monitor</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a monitor on the
     * caller would block start() for the worker's lifetime.
     *
     * <p>Shutdown does not wait for tasks: monitors and backoff sleeps are abandoned once the
     * worker has been stopped.
     *
     * @return executor for sidecar background tasks
     */
    @Bean(name = "sidecarExecutor")
    public ThreadPoolTaskExecutor sidecarExecutor() {
        ThreadPoolProperties.SidecarPoolProperties props = threadPoolProperties.getSidecar();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setDaemon(true);
        executor.setTaskDecorator(contextPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for the periodic health-check loop (and {@code @Scheduled} summaries).
     *
     * @return scheduler for periodic sidecar work
     */
    @Bean(name = "sidecarScheduler")
    public ThreadPoolTaskScheduler sidecarScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) of the submitting thread into the worker thread
     * and restores the worker's previous context afterwards.
     */
    static TaskDecorator contextPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
