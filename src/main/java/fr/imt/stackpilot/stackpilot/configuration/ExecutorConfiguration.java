package fr.imt.stackpilot.stackpilot.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfiguration {

    private static final int NOTIFY_CORE_POOL_SIZE = 2;
    private static final int NOTIFY_MAX_POOL_SIZE = 4;
    private static final int NOTIFY_QUEUE_CAPACITY = 50;

    /**
     * Bounded pool for notification sends. When it is saturated further sends are rejected and
     * skipped by the caller. Spring initializes and shuts it down with the context.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(NOTIFY_CORE_POOL_SIZE);
        executor.setMaxPoolSize(NOTIFY_MAX_POOL_SIZE);
        executor.setQueueCapacity(NOTIFY_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("notify-");
        executor.setDaemon(true);
        return executor;
    }
}
