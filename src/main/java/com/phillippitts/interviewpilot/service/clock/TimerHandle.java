package com.phillippitts.interviewpilot.service.clock;

/**
 * Handle to a scheduled timer. {@link #cancel()} is idempotent and safe after the timer fired.
 */
public interface TimerHandle {

    TimerHandle NONE = new TimerHandle() {
        @Override
        public void cancel() {
        }

        @Override
        public boolean isCancelled() {
            return true;
        }
    };

    void cancel();

    boolean isCancelled();
}
