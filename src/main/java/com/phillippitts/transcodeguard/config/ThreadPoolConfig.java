package com.phillippitts.transcodeguard.config;

import com.phillippitts.transcodeguard.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used off the coordinator's lock.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned in
 * application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Delivers event bus notifications to subscribers.
     *
     * <p>Pool sizing configured via {@code threadpool.event.*}:
     * <ul>
     *   <li>Core pool: default 2</li>
     *   <li>Max pool: default 4</li>
     *   <li>Queue: default 100 drain tasks (one per lagging subscriber at most)</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The bus counts a rejected
     * delivery as dropped events; running subscriber code on the publishing thread would run it
     * under the coordinator's lock.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the publishing thread, so
     * listener log lines keep the {@code jobId}.
     *
     * @return executor for event delivery
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return newExecutor(threadPoolProperties.getEvent());
    }

    /**
     * Runs pre-flight file system checks for submissions, bounded by the precheck timeout.
     *
     * <p>Pool sizing configured via {@code threadpool.precheck.*}. Only one job is prepared at
     * a time, so one core thread suffices; the spare thread covers a check still hung on a
     * slow volume after its submission timed out.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected check fails the
     * job instead of running without a timeout on the caller's thread.
     *
     * @return executor for pre-flight checks
     */
    @Bean(name = "precheckExecutor")
    public ThreadPoolTaskExecutor precheckExecutor() {
        return newExecutor(threadPoolProperties.getPrecheck());
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker for the task's duration.
     */
    static TaskDecorator mdcPropagating() {
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
