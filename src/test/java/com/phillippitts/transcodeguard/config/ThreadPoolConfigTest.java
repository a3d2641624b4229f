package com.phillippitts.transcodeguard.config;

import com.phillippitts.transcodeguard.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void eventExecutorUsesDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).eventExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getQueueCapacity()).isEqualTo(100);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("event-pool-");
    }

    @Test
    void precheckExecutorUsesDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).precheckExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("precheck-pool-");
    }

    @Test
    void handlesConcurrentTasks() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).eventExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completed.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
    }

    @Test
    void rejectsWhenSaturated() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).precheckExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        try {
            // 2 threads + 4 queued
            for (int i = 0; i < 6; i++) {
                executor.execute(blocker);
            }
            assertThatThrownBy(() -> executor.execute(blocker))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void propagatesThreadContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).eventExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        ThreadContext.put("jobId", "job-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get("jobId"));
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("job-42");
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("jobId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() ->
                assertThat(ThreadContext.get("jobId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("jobId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("jobId")).isEqualTo("worker");
    }
}
