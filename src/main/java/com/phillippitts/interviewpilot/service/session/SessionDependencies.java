package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.service.budget.TimeBudgetAllocator;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.decision.FollowUpDecisionEngine;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import com.phillippitts.interviewpilot.service.speech.SpeechIoAdapter;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Groups the shared collaborators every session conductor needs, to keep
 * {@link InterviewSessionService}'s constructor short.
 */
public final class SessionDependencies {
    private final SpeechIoAdapter speech;
    private final FollowUpDecisionEngine decisions;
    private final TimeBudgetAllocator allocator;
    private final InterviewClock clock;
    private final Executor sessionExecutor;
    private final ApplicationEventPublisher publisher;
    private final InterviewMetricsPublisher metrics;

    public SessionDependencies(SpeechIoAdapter speech,
                               FollowUpDecisionEngine decisions,
                               TimeBudgetAllocator allocator,
                               InterviewClock clock,
                               Executor sessionExecutor,
                               ApplicationEventPublisher publisher,
                               InterviewMetricsPublisher metrics) {
        this.speech = Objects.requireNonNull(speech, "speech must not be null");
        this.decisions = Objects.requireNonNull(decisions, "decisions must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
    }

    public SpeechIoAdapter getSpeech() {
        return speech;
    }

    public FollowUpDecisionEngine getDecisions() {
        return decisions;
    }

    public TimeBudgetAllocator getAllocator() {
        return allocator;
    }

    public InterviewClock getClock() {
        return clock;
    }

    public Executor getSessionExecutor() {
        return sessionExecutor;
    }

    public ApplicationEventPublisher getPublisher() {
        return publisher;
    }

    public InterviewMetricsPublisher getMetrics() {
        return metrics;
    }
}
