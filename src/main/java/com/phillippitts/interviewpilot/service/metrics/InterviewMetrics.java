package com.phillippitts.interviewpilot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for interview sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Session starts and terminal phases</li>
 *   <li>Decisions by kind</li>
 *   <li>Speech engine latency and failures per engine and operation</li>
 *   <li>Scoring failures and items skipped for lack of time</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class InterviewMetrics {

    private static final String METRIC_PREFIX = "interviewpilot";

    private final MeterRegistry registry;

    public InterviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementSessionsStarted() {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Number of interview sessions started")
                .register(registry)
                .increment();
    }

    /**
     * @param phase    terminal phase (COMPLETED or ABORTED)
     * @param deadline whether the global deadline forced closing
     */
    public void incrementSessionsTerminated(String phase, boolean deadline) {
        Counter.builder(METRIC_PREFIX + ".sessions.terminated")
                .description("Number of interview sessions that reached a terminal phase")
                .tag("phase", phase)
                .tag("deadline", Boolean.toString(deadline))
                .register(registry)
                .increment();
    }

    /**
     * @param kind decision kind (ADVANCE, FOLLOW_UP, FORCE_ADVANCE)
     */
    public void incrementDecision(String kind) {
        Counter.builder(METRIC_PREFIX + ".decisions")
                .description("Number of follow-up decisions by kind")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records latency of a speech engine call.
     *
     * @param engineName    engine name
     * @param operation     transcribe or synthesize
     * @param durationNanos duration in nanoseconds
     */
    public void recordSpeechLatency(String engineName, String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".speech.latency")
                .description("Time taken by speech engine calls")
                .tag("engine", engineName)
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param engineName engine name
     * @param operation  transcribe or synthesize
     * @param reason     timeout, error or disabled
     */
    public void incrementSpeechFailure(String engineName, String operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".speech.failure")
                .description("Number of failed speech engine calls")
                .tag("engine", engineName)
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param reason timeout or error
     */
    public void incrementScoringFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".scoring.failure")
                .description("Number of scoring calls that failed open")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementItemsSkipped(int count) {
        Counter.builder(METRIC_PREFIX + ".budget.skipped")
                .description("Number of plan items skipped because minimums did not fit")
                .register(registry)
                .increment(count);
    }
}
