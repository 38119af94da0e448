package com.phillippitts.interviewpilot.service.async;

import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.clock.TimerHandle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Single suspend-point primitive: wraps an async call with a clock timeout and a cancellation token.
 *
 * <p>Every external call a session makes (synthesis, transcription, scoring) goes through
 * {@link #call}, so the timeout path and the deadline/abort path are the same everywhere:
 * <ul>
 *   <li>timeout → the inner future is cancelled and the result fails with the supplied exception</li>
 *   <li>scope cancelled → the inner future is cancelled and the result fails with
 *       {@link CancellationException}</li>
 *   <li>inner completes first → the timer is cancelled and the token released</li>
 * </ul>
 */
public final class TimedCalls {

    private final InterviewClock clock;

    public TimedCalls(InterviewClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts an async call and bounds it by {@code timeout}.
     *
     * @param starter   starts the call; may throw, which fails the result
     * @param timeout   maximum time to wait for the call
     * @param scope     cancellation scope of the owning session
     * @param onTimeout builds the failure used when the timeout fires
     * @param <T>       result type
     * @return future completed with the call's value, its failure, the timeout failure or a
     *         cancellation, whichever happens first
     */
    public <T> CompletableFuture<T> call(Supplier<? extends CompletableFuture<T>> starter,
                                         Duration timeout,
                                         CancellationScope scope,
                                         Supplier<? extends RuntimeException> onTimeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        if (scope.isClosed()) {
            result.completeExceptionally(new CancellationException("scope closed"));
            return result;
        }

        CompletableFuture<T> inner;
        try {
            inner = Objects.requireNonNull(starter.get(), "starter returned null");
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return result;
        }

        CancellationToken token = scope.register(() -> {
            if (result.completeExceptionally(new CancellationException("cancelled"))) {
                inner.cancel(true);
            }
        });
        TimerHandle timer = inner.isDone() ? TimerHandle.NONE : clock.schedule(timeout, () -> {
            if (result.completeExceptionally(onTimeout.get())) {
                inner.cancel(true);
            }
        });

        inner.whenComplete((value, error) -> {
            timer.cancel();
            token.release();
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(unwrap(error));
            }
        });
        return result;
    }

    /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
