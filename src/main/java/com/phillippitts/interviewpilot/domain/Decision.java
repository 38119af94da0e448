package com.phillippitts.interviewpilot.domain;

import java.util.Objects;

/**
 * Verdict on how to proceed after an answer.
 *
 * <p>Closed set of variants. Consumers switch on {@link #kind()} so that every case is handled.
 */
public sealed interface Decision permits Decision.Advance, Decision.FollowUp, Decision.ForceAdvance {

    enum Kind { ADVANCE, FOLLOW_UP, FORCE_ADVANCE }

    Kind kind();

    /** Short machine-readable reason, for logs and summaries. */
    String reason();

    static Decision advance(String reason) {
        return new Advance(reason);
    }

    static Decision followUp(String text) {
        return new FollowUp(text);
    }

    static Decision forceAdvance(String reason) {
        return new ForceAdvance(reason);
    }

    /** Answer accepted; move to the next item. */
    record Advance(String reason) implements Decision {
        public Advance {
            reason = reason == null ? "" : reason;
        }

        @Override
        public Kind kind() {
            return Kind.ADVANCE;
        }
    }

    /** Ask one more question on the same item. */
    record FollowUp(String text) implements Decision {
        public FollowUp {
            Objects.requireNonNull(text, "text must not be null");
            if (text.isBlank()) {
                throw new IllegalArgumentException("follow-up text must not be blank");
            }
        }

        @Override
        public Kind kind() {
            return Kind.FOLLOW_UP;
        }

        @Override
        public String reason() {
            return "low-coverage";
        }
    }

    /** Move on regardless of the answer, because time or input ran out. */
    record ForceAdvance(String reason) implements Decision {
        public ForceAdvance {
            reason = reason == null ? "" : reason;
        }

        @Override
        public Kind kind() {
            return Kind.FORCE_ADVANCE;
        }
    }
}
