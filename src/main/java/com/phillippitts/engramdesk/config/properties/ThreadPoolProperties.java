package com.phillippitts.engramdesk.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the sidecar task group.
 *
 * <p>The executor runs one output monitor per spawned worker for the worker's whole life,
 * plus short-lived grace-period tasks, so it is sized in threads rather than queue slots.
 * The scheduler drives the periodic health check.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SidecarPoolProperties sidecar = new SidecarPoolProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    public SidecarPoolProperties getSidecar() {
        return sidecar;
    }

    public void setSidecar(SidecarPoolProperties sidecar) {
        this.sidecar = sidecar;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Sidecar task group configuration.
     */
    public static class SidecarPoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 16;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "sidecar-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Scheduler configuration for periodic sidecar work.
     */
    public static class SchedulerProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "sidecar-sched-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
