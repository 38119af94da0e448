package com.phillippitts.interviewpilot.service.async;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link CompletableFuture} for blocking work whose {@link #cancel(boolean)} interrupts the worker.
 *
 * <p>A plain {@code CompletableFuture.supplyAsync} cannot stop a blocked thread; this class keeps the
 * underlying {@link FutureTask} so that a timeout or a session abort actually frees the thread.
 *
 * @param <T> result type
 */
public final class InterruptibleTask<T> extends CompletableFuture<T> {

    private final FutureTask<T> task;

    private InterruptibleTask(Callable<T> callable) {
        this.task = new FutureTask<>(callable) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    return;
                }
                try {
                    InterruptibleTask.this.complete(get());
                } catch (ExecutionException e) {
                    InterruptibleTask.this.completeExceptionally(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    InterruptibleTask.this.completeExceptionally(e);
                }
            }
        };
    }

    /**
     * Submits {@code callable} to {@code executor}.
     *
     * @return future completed with the callable's result; fails if the executor rejects the task
     */
    public static <T> InterruptibleTask<T> supply(Executor executor, Callable<T> callable) {
        InterruptibleTask<T> future = new InterruptibleTask<>(callable);
        try {
            executor.execute(future.task);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        task.cancel(true);
        return cancelled;
    }
}
