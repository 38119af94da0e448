package com.phillippitts.interviewpilot.domain;

import java.util.Objects;

/**
 * Why a session was aborted.
 *
 * @param cause  what triggered the abort
 * @param detail free-form detail for operators; never contains transcript text
 */
public record AbortReason(Cause cause, String detail) {

    public enum Cause {
        /** Explicit abort from the candidate channel or an operator. */
        EXTERNAL,
        /** The candidate channel closed before the session finished. */
        CHANNEL_CLOSED,
        /** A downstream failure that no fallback covers. */
        DOWNSTREAM_FAILURE,
        /** Application shutdown. */
        SHUTDOWN
    }

    public AbortReason {
        Objects.requireNonNull(cause, "cause must not be null");
        detail = detail == null ? "" : detail;
    }

    public static AbortReason external(String detail) {
        return new AbortReason(Cause.EXTERNAL, detail);
    }

    public FailureKind kind() {
        return FailureKind.ABORTED;
    }
}
