package com.phillippitts.interviewpilot.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link InterviewMetrics}.
 *
 * <p>Components record through this publisher so that they can run without a meter registry in
 * unit tests. The {@link #NOOP} instance performs no operations and never throws.
 *
 * @see InterviewMetrics
 */
@Component
public final class InterviewMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(InterviewMetricsPublisher.class);

    /**
     * Singleton no-op instance for test environments.
     */
    public static final InterviewMetricsPublisher NOOP = new InterviewMetricsPublisher(null);

    private final InterviewMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public InterviewMetricsPublisher(InterviewMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("InterviewMetricsPublisher created without metrics (test mode)");
        }
    }

    public void sessionStarted() {
        if (metrics != null) {
            metrics.incrementSessionsStarted();
        }
    }

    public void sessionTerminated(String phase, boolean deadline) {
        if (metrics != null) {
            metrics.incrementSessionsTerminated(phase, deadline);
        }
    }

    public void decision(String kind) {
        if (metrics != null) {
            metrics.incrementDecision(kind);
        }
    }

    public void speechSuccess(String engineName, String operation, long durationNanos) {
        if (metrics != null) {
            metrics.recordSpeechLatency(engineName, operation, durationNanos);
        }
    }

    public void speechFailure(String engineName, String operation, String reason) {
        if (metrics != null) {
            metrics.incrementSpeechFailure(engineName, operation, reason);
        }
    }

    public void scoringFailure(String reason) {
        if (metrics != null) {
            metrics.incrementScoringFailure(reason);
        }
    }

    public void itemsSkipped(int count) {
        if (metrics != null && count > 0) {
            metrics.incrementItemsSkipped(count);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
