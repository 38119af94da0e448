package com.phillippitts.interviewpilot.service.clock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Production clock: wall time anchored once, advanced by {@link System#nanoTime()}, with timers
 * backed by a Spring {@link TaskScheduler}.
 *
 * <p>Anchoring keeps {@link #now()} monotonic even if the system clock is adjusted while an
 * interview is running.
 */
public final class SystemInterviewClock implements InterviewClock {

    private static final Logger LOG = LogManager.getLogger(SystemInterviewClock.class);

    private final TaskScheduler scheduler;
    private final Instant anchor;
    private final long anchorNanos;

    public SystemInterviewClock(TaskScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.anchor = Instant.now();
        this.anchorNanos = System.nanoTime();
    }

    @Override
    public Instant now() {
        return anchor.plusNanos(System.nanoTime() - anchorNanos);
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        Duration effective = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        // TaskScheduler works on wall time; convert the monotonic delay at scheduling time
        ScheduledFuture<?> future = scheduler.schedule(guarded(task), Instant.now().plus(effective));
        return new FutureTimerHandle(future);
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Timer task failed: {}", e.toString(), e);
            }
        };
    }

    private record FutureTimerHandle(ScheduledFuture<?> future) implements TimerHandle {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
