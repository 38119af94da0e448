package com.phillippitts.interviewpilot.domain;

import java.time.Instant;

/**
 * Non-fatal condition surfaced in the session summary.
 */
public record SessionWarning(FailureKind kind, Instant at, String detail) {
}
