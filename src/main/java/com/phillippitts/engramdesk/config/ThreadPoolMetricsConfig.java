package com.phillippitts.engramdesk.config;

import com.phillippitts.engramdesk.service.sidecar.SidecarSnapshot;
import com.phillippitts.engramdesk.service.sidecar.SidecarState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Micrometer bindings for the sidecar task group and the supervisor state.
 *
 * <p>Exposes:
 * <ul>
 *   <li>sidecar.pool.size / active / completed / core.size / max.size - task group usage</li>
 *   <li>sidecar.restart.count - automatic restarts consumed since the last healthy start</li>
 *   <li>sidecar.status - lifecycle status as its ordinal (0=stopped, 1=starting, 2=running, 3=crashed)</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/sidecar.status}. A summary is also logged
 * every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sidecarExecutorProvider;
    private final SidecarState state;

    public ThreadPoolMetricsConfig(
            @Qualifier("sidecarExecutor") ObjectProvider<ThreadPoolTaskExecutor> sidecarExecutorProvider,
            SidecarState state) {
        this.sidecarExecutorProvider = sidecarExecutorProvider;
        this.state = state;
    }

    @Bean
    public MeterBinder sidecarExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = sidecarExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("sidecar.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the sidecar task group")
                    .register(registry);

            Gauge.builder("sidecar.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Sidecar background tasks currently running")
                    .register(registry);

            Gauge.builder("sidecar.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed sidecar background tasks")
                    .register(registry);

            Gauge.builder("sidecar.pool.core.size", executor, ThreadPoolExecutor::getCorePoolSize)
                    .description("Configured core pool size for the sidecar task group")
                    .register(registry);

            Gauge.builder("sidecar.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the sidecar task group")
                    .register(registry);

            LOG.info("Sidecar thread pool metrics registered: sidecar.pool.* available via /actuator/metrics");
        };
    }

    @Bean
    public MeterBinder sidecarStateMetrics() {
        return registry -> {
            Gauge.builder("sidecar.restart.count", state, SidecarState::restartCount)
                    .description("Automatic restarts consumed since the last healthy start")
                    .register(registry);

            Gauge.builder("sidecar.status", state, s -> s.status().ordinal())
                    .description("Sidecar lifecycle status (0=stopped, 1=starting, 2=running, 3=crashed)")
                    .register(registry);
        };
    }

    /**
     * Logs supervisor and task group health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSidecarHealth() {
        ThreadPoolExecutor executor = sidecarExecutorProvider.getObject().getThreadPoolExecutor();
        SidecarSnapshot snapshot = state.snapshot();

        LOG.info("Sidecar Health: status={}, pid={}, restarts={}, pool={}/{}, active={}, completed={}",
                snapshot.status().value(),
                snapshot.pid(),
                snapshot.restartCount(),
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getCompletedTaskCount()
        );
    }
}
