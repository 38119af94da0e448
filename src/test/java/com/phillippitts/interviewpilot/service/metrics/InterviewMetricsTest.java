package com.phillippitts.interviewpilot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InterviewMetricsTest {

    private MeterRegistry registry;
    private InterviewMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new InterviewMetrics(registry);
    }

    @Test
    void shouldCountSessionStartsAndTerminations() {
        metrics.incrementSessionsStarted();
        metrics.incrementSessionsStarted();
        metrics.incrementSessionsTerminated("COMPLETED", true);

        assertThat(registry.get("interviewpilot.sessions.started").counter().count()).isEqualTo(2.0);
        Counter terminated = registry.find("interviewpilot.sessions.terminated")
                .tag("phase", "COMPLETED")
                .tag("deadline", "true")
                .counter();
        assertThat(terminated).isNotNull();
        assertThat(terminated.count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagDecisionsByKind() {
        metrics.incrementDecision("FOLLOW_UP");
        metrics.incrementDecision("ADVANCE");
        metrics.incrementDecision("FOLLOW_UP");

        assertThat(registry.get("interviewpilot.decisions").tag("kind", "FOLLOW_UP").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("interviewpilot.decisions").tag("kind", "ADVANCE").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordSpeechLatencyPerEngineAndOperation() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordSpeechLatency("stt-http", "transcribe", durationNanos);

        Timer timer = registry.find("interviewpilot.speech.latency")
                .tag("engine", "stt-http")
                .tag("operation", "transcribe")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldCountFailuresByReason() {
        metrics.incrementSpeechFailure("tts-http", "synthesize", "timeout");
        metrics.incrementScoringFailure("error");
        metrics.incrementItemsSkipped(3);

        assertThat(registry.get("interviewpilot.speech.failure")
                .tags("engine", "tts-http", "operation", "synthesize", "reason", "timeout")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("interviewpilot.scoring.failure").tag("reason", "error").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("interviewpilot.budget.skipped").counter().count()).isEqualTo(3.0);
    }
}
