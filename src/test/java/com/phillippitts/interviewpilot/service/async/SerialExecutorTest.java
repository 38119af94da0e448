package com.phillippitts.interviewpilot.service.async;

import com.phillippitts.interviewpilot.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SerialExecutorTest {

    @Test
    void queuesReentrantTasksBehindTheRunningOne() {
        SerialExecutor serial = new SerialExecutor(new SyncExecutor());
        List<String> order = new CopyOnWriteArrayList<>();

        serial.execute(() -> {
            order.add("outer-start");
            serial.execute(() -> order.add("inner"));
            order.add("outer-end");
        });

        assertThat(order).containsExactly("outer-start", "outer-end", "inner");
    }

    @Test
    void keepsDrainingAfterTaskFailure() {
        SerialExecutor serial = new SerialExecutor(new SyncExecutor());
        List<String> order = new CopyOnWriteArrayList<>();

        serial.execute(() -> {
            serial.execute(() -> order.add("after"));
            throw new IllegalStateException("boom");
        });
        serial.execute(() -> order.add("next"));

        assertThat(order).containsExactly("after", "next");
    }

    @Test
    void neverRunsTwoTasksAtOnceOnSharedPool() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            SerialExecutor serial = new SerialExecutor(pool);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            List<Integer> order = new CopyOnWriteArrayList<>();
            int taskCount = 50;
            CountDownLatch latch = new CountDownLatch(taskCount);

            for (int i = 0; i < taskCount; i++) {
                int n = i;
                serial.execute(() -> {
                    int now = running.incrementAndGet();
                    maxRunning.accumulateAndGet(now, Math::max);
                    order.add(n);
                    running.decrementAndGet();
                    latch.countDown();
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(maxRunning.get()).isEqualTo(1);
            assertThat(order).hasSize(taskCount).isSorted();
        } finally {
            pool.shutdownNow();
        }
    }
}
