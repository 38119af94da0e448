package com.phillippitts.interviewpilot.service.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Monotonic time source and cancellable timers shared by all sessions.
 *
 * <p>{@link #now()} never goes backwards. Deadlines, per-item caps and per-call timeouts are all
 * expressed as timers scheduled here so that tests can drive time explicitly.
 */
public interface InterviewClock {

    /**
     * Returns the current instant. Successive calls never return a smaller value.
     */
    Instant now();

    /**
     * Schedules {@code task} to run once after {@code delay}. A zero or negative delay runs the
     * task as soon as possible.
     *
     * @return handle that cancels the timer if it has not fired yet
     */
    TimerHandle schedule(Duration delay, Runnable task);

    /**
     * Schedules {@code task} to run at {@code at}, or as soon as possible if that time has passed.
     */
    default TimerHandle scheduleAt(Instant at, Runnable task) {
        Duration delay = Duration.between(now(), at);
        return schedule(delay.isNegative() ? Duration.ZERO : delay, task);
    }
}
