package com.phillippitts.transcodeguard.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the event and precheck pools via Micrometer.
 *
 * <p>For each pool ({@code event}, {@code precheck}):
 * <ul>
 *   <li>transcodeguard.pool.size - Current number of threads</li>
 *   <li>transcodeguard.pool.active - Threads executing tasks</li>
 *   <li>transcodeguard.pool.queued - Tasks waiting in the queue</li>
 *   <li>transcodeguard.pool.completed - Cumulative completed tasks</li>
 * </ul>
 * tagged {@code pool=event|precheck}.
 *
 * <p>Additionally logs a summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ThreadPoolTaskExecutor eventExecutor;
    private final ThreadPoolTaskExecutor precheckExecutor;

    public ThreadPoolMetricsConfig(@Qualifier("eventExecutor") ThreadPoolTaskExecutor eventExecutor,
                                   @Qualifier("precheckExecutor") ThreadPoolTaskExecutor precheckExecutor) {
        this.eventExecutor = eventExecutor;
        this.precheckExecutor = precheckExecutor;
    }

    @Bean
    public MeterBinder threadPoolMetrics() {
        return registry -> {
            bind(registry, "event", eventExecutor.getThreadPoolExecutor());
            bind(registry, "precheck", precheckExecutor.getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: transcodeguard.pool.* available via /actuator/metrics");
        };
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("transcodeguard.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("transcodeguard.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("transcodeguard.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("transcodeguard.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs pool health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("event", eventExecutor.getThreadPoolExecutor());
        log("precheck", precheckExecutor.getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("Thread pool '{}': size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
