package com.phillippitts.interviewpilot.service.async;

/**
 * Registration of one outstanding async call in a {@link CancellationScope}.
 */
public interface CancellationToken {

    /** Runs the cancel action once, if the call is still outstanding. */
    void cancel();

    /** Removes the token from its scope once the call has finished. */
    void release();

    boolean isCancelled();
}
