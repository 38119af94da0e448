package com.phillippitts.interviewpilot.service.async;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-session set of cancellation tokens for outstanding async calls.
 *
 * <p>{@link #cancelAll()} cancels every registered call and leaves the scope open for new ones
 * (used when the deadline forces closing). {@link #close()} cancels everything and makes any later
 * registration cancel immediately (used on terminal phases).
 *
 * <p><b>Thread Safety:</b> registration, release and cancellation may happen on any thread.
 */
public final class CancellationScope {

    private static final Logger LOG = LogManager.getLogger(CancellationScope.class);

    private final String owner;
    private final Set<Token> tokens = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public CancellationScope(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
    }

    /**
     * Registers a cancel action for an outstanding call.
     *
     * <p>If the scope is already closed the action runs immediately and the returned token is
     * already cancelled.
     *
     * @param onCancel action that aborts the call
     * @return token to release when the call finishes
     */
    public CancellationToken register(Runnable onCancel) {
        Token token = new Token(Objects.requireNonNull(onCancel, "onCancel must not be null"));
        tokens.add(token);
        if (closed) {
            token.cancel();
        }
        return token;
    }

    /**
     * Cancels every outstanding call.
     *
     * @return number of calls cancelled
     */
    public int cancelAll() {
        List<Token> snapshot = new ArrayList<>(tokens);
        int cancelled = 0;
        for (Token token : snapshot) {
            if (token.cancelInternal()) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            LOG.debug("Cancelled {} outstanding call(s) for {}", cancelled, owner);
        }
        return cancelled;
    }

    /** Cancels everything and rejects later registrations. Idempotent. */
    public void close() {
        closed = true;
        cancelAll();
    }

    public boolean isClosed() {
        return closed;
    }

    public int outstanding() {
        return tokens.size();
    }

    private final class Token implements CancellationToken {

        private final Runnable onCancel;
        private final AtomicBoolean done = new AtomicBoolean();
        private volatile boolean cancelled;

        private Token(Runnable onCancel) {
            this.onCancel = onCancel;
        }

        @Override
        public void cancel() {
            cancelInternal();
        }

        private boolean cancelInternal() {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            cancelled = true;
            tokens.remove(this);
            try {
                onCancel.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancel action failed for {}: {}", owner, e.toString());
            }
            return true;
        }

        @Override
        public void release() {
            if (done.compareAndSet(false, true)) {
                tokens.remove(this);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
