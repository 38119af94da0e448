package com.phillippitts.interviewpilot.service.events;

import com.phillippitts.interviewpilot.domain.AbortReason;
import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.service.session.event.BudgetExhaustedEvent;
import com.phillippitts.interviewpilot.service.session.event.ExchangeCompletedEvent;
import com.phillippitts.interviewpilot.service.session.event.SessionTerminatedEvent;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineFailureEvent;
import com.phillippitts.interviewpilot.service.speech.watchdog.EngineRecoveredEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SessionEventsListenerTest {

    private final SessionEventsListener listener = new SessionEventsListener();

    @Test
    void throttlesRepeatedKeys() {
        assertThat(listener.shouldLog("budget-s1")).isTrue();
        assertThat(listener.shouldLog("budget-s1")).isFalse();
        assertThat(listener.shouldLog("budget-s2")).isTrue();
    }

    @Test
    void handlesEveryEventType() {
        Instant now = Instant.parse("2026-01-05T09:00:00Z");
        Exchange exchange = new Exchange("q1", 0, "Describe a cache.", "call me at 5551234567",
                Decision.advance("covered"), Duration.ofMinutes(3), now);
        SessionSummary summary = new SessionSummary("s1", "cand", "job", SessionPhase.ABORTED, now,
                now.plus(Duration.ofMinutes(30)), now.plus(Duration.ofMinutes(4)), List.of(exchange), List.of(),
                List.of(), List.of(), List.of(), AbortReason.external("operator"), false);

        assertThatCode(() -> {
            listener.onExchangeCompleted(new ExchangeCompletedEvent("s1", exchange));
            listener.onBudgetExhausted(new BudgetExhaustedEvent("s1", List.of("q3"), Duration.ofMinutes(2), now));
            listener.onEngineFailure(new EngineFailureEvent("stt-http", now, "transcribe timeout", null,
                    Map.of("operation", "transcribe")));
            listener.onEngineRecovered(new EngineRecoveredEvent("stt-http", now));
            listener.onSessionTerminated(new SessionTerminatedEvent(summary));
        }).doesNotThrowAnyException();
    }

    @Test
    void engineFailuresAreThrottledPerOperation() {
        Instant now = Instant.now();
        listener.onEngineFailure(new EngineFailureEvent("tts-http", now, "synthesize error", null,
                Map.of("operation", "synthesize")));

        assertThat(listener.shouldLog("engine-tts-http-synthesize")).isFalse();
        assertThat(listener.shouldLog("engine-tts-http-transcribe")).isTrue();
    }
}
