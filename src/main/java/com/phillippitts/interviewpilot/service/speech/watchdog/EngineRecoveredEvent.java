package com.phillippitts.interviewpilot.service.speech.watchdog;

import java.time.Instant;

/**
 * Published when a previously failing engine completes a call successfully.
 */
public record EngineRecoveredEvent(String engine, Instant at) {
}
