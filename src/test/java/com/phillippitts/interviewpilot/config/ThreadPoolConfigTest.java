package com.phillippitts.interviewpilot.config;

import com.phillippitts.interviewpilot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateSessionExecutorFromDefaults() {
        Executor executor = config.sessionExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        try {
            assertThat(taskExecutor.getCorePoolSize()).isEqualTo(4);
            assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(16);
            assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("session-pool-");
        } finally {
            taskExecutor.shutdown();
        }
    }

    @Test
    void shouldCreateIoExecutorFromCustomProperties() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setIo(new ThreadPoolProperties.PoolProperties(2, 3, 10, "custom-io-"));
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).ioExecutor();
        try {
            assertThat(taskExecutor.getCorePoolSize()).isEqualTo(2);
            assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(3);
            assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("custom-io-");
        } finally {
            taskExecutor.shutdown();
        }
    }

    @Test
    void shouldCreateTimerScheduler() {
        ThreadPoolTaskScheduler scheduler = config.taskScheduler();
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(2);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("timer-");
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.ioExecutor();
        int taskCount = 10;
        AtomicInteger completedTasks = new AtomicInteger(0);
        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(completedTasks::incrementAndGet);
            }
            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(completedTasks.get()).isEqualTo(taskCount));
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.sessionExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        try {
            ThreadContext.put("sessionId", "s-77");
            executor.execute(() -> {
                seen.set(ThreadContext.get("sessionId"));
                latch.countDown();
            });

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("s-77");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("sessionId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagation().decorate(() ->
                assertThat(ThreadContext.get("sessionId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "w-1");
        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("w-1");
    }
}
