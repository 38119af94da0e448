package com.phillippitts.interviewpilot.service.speech.watchdog;

import com.phillippitts.interviewpilot.config.properties.WatchdogProperties;
import com.phillippitts.interviewpilot.testutil.EventCapturingPublisher;
import com.phillippitts.interviewpilot.testutil.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog.EngineState.DEGRADED;
import static com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog.EngineState.DISABLED;
import static com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog.EngineState.HEALTHY;
import static org.assertj.core.api.Assertions.assertThat;

class EngineWatchdogTest {

    private ManualClock clock;
    private EventCapturingPublisher publisher;
    private EngineWatchdog watchdog;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        publisher = new EventCapturingPublisher();
        WatchdogProperties props = new WatchdogProperties();
        props.setWindowMinutes(10);
        props.setMaxFailuresPerWindow(3);
        props.setCooldownMinutes(5);
        watchdog = new EngineWatchdog(List.of("stt", "tts"), props, publisher, clock);
    }

    private void fail(String engine) {
        watchdog.onFailure(new EngineFailureEvent(engine, clock.now(), "transcribe timeout", null,
                Map.of("operation", "transcribe", "reason", "timeout")));
    }

    @Test
    void startsHealthy() {
        assertThat(watchdog.engines()).containsExactlyInAnyOrder("stt", "tts");
        assertThat(watchdog.getState("stt")).isEqualTo(HEALTHY);
        assertThat(watchdog.isEngineEnabled("stt")).isTrue();
    }

    @Test
    void degradesOnFirstFailureAndDisablesAtBudget() {
        fail("stt");
        assertThat(watchdog.getState("stt")).isEqualTo(DEGRADED);
        assertThat(watchdog.isEngineEnabled("stt")).isTrue();

        fail("stt");
        fail("stt");

        assertThat(watchdog.getState("stt")).isEqualTo(DISABLED);
        assertThat(watchdog.isEngineEnabled("stt")).isFalse();
        assertThat(watchdog.getState("tts")).isEqualTo(HEALTHY);
    }

    @Test
    void allowsCallsAgainAfterCooldown() {
        fail("stt");
        fail("stt");
        fail("stt");

        clock.advance(Duration.ofMinutes(4));
        assertThat(watchdog.isEngineEnabled("stt")).isFalse();

        clock.advance(Duration.ofMinutes(1));
        assertThat(watchdog.isEngineEnabled("stt")).isTrue();
        assertThat(watchdog.getState("stt")).isEqualTo(DEGRADED);
    }

    @Test
    void forgetsFailuresOutsideWindow() {
        fail("stt");
        fail("stt");
        clock.advance(Duration.ofMinutes(11));

        fail("stt");

        assertThat(watchdog.getState("stt")).isEqualTo(DEGRADED);
        assertThat(watchdog.isEngineEnabled("stt")).isTrue();
    }

    @Test
    void successRestoresHealthAndPublishesRecovery() {
        fail("tts");

        watchdog.recordSuccess("tts");

        assertThat(watchdog.getState("tts")).isEqualTo(HEALTHY);
        List<EngineRecoveredEvent> recovered = publisher.eventsOf(EngineRecoveredEvent.class);
        assertThat(recovered).hasSize(1);
        assertThat(recovered.get(0).engine()).isEqualTo("tts");
    }

    @Test
    void successOnHealthyEnginePublishesNothing() {
        watchdog.recordSuccess("tts");

        assertThat(publisher.eventsOf(EngineRecoveredEvent.class)).isEmpty();
    }

    @Test
    void ignoresUnknownEngines() {
        fail("unknown");

        assertThat(watchdog.isEngineEnabled("unknown")).isTrue();
        assertThat(watchdog.engines()).doesNotContain("unknown");
    }

    @Test
    void healthSummaryDoesNotThrow() {
        fail("stt");
        watchdog.logHealthSummary();
        assertThat(watchdog.getState("stt")).isEqualTo(DEGRADED);
    }
}
