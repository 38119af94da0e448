package com.phillippitts.interviewpilot.exception;

import com.phillippitts.interviewpilot.domain.SessionPhase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void interviewPilotExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        InterviewPilotException ex = new InterviewPilotException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void speechExceptionShouldIncludeEngineName() {
        SpeechException ex = new SpeechException("Synthesis request failed", "remote-tts");

        assertThat(ex.getMessage()).isEqualTo("Synthesis request failed (engine: remote-tts)");
        assertThat(ex.getEngineName()).isEqualTo("remote-tts");
        assertThat(new SpeechException("no engine").getEngineName()).isEqualTo("unknown");
    }

    @Test
    void speechTimeoutExceptionShouldIncludeTimeout() {
        SpeechTimeoutException ex = new SpeechTimeoutException("Transcription", "remote-stt", Duration.ofSeconds(10));

        assertThat(ex).isInstanceOf(SpeechException.class);
        assertThat(ex.getMessage()).contains("Transcription timed out after 10000ms");
        assertThat(ex.getTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void scoringExceptionShouldFlagTimeout() {
        assertThat(new ScoringException("Scoring timed out", true).isTimeout()).isTrue();
        assertThat(new ScoringException("Scoring request failed", new IOException("reset")).isTimeout()).isFalse();
    }

    @Test
    void invalidPlanExceptionShouldCopyViolations() {
        InvalidPlanException single = new InvalidPlanException("Plan must not be empty");
        assertThat(single.getViolations()).containsExactly("Plan must not be empty");

        InvalidPlanException many = new InvalidPlanException("Invalid plan", List.of("a", "b"));
        assertThatThrownBy(() -> many.getViolations().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void illegalSessionStateExceptionShouldIncludePhase() {
        IllegalSessionStateException ex = new IllegalSessionStateException("start requires CREATED",
                SessionPhase.LISTENING);

        assertThat(ex.getMessage()).isEqualTo("start requires CREATED (phase: LISTENING)");
        assertThat(ex.getPhase()).isEqualTo(SessionPhase.LISTENING);
    }

    @Test
    void allExceptionsShouldExtendBaseException() {
        assertThat(new SpeechException("x")).isInstanceOf(InterviewPilotException.class);
        assertThat(new ScoringException("x", false)).isInstanceOf(InterviewPilotException.class);
        assertThat(new InvalidPlanException("x")).isInstanceOf(InterviewPilotException.class);
        assertThat(new SessionNotFoundException("s-1")).isInstanceOf(InterviewPilotException.class);
        assertThat(new SessionNotFoundException("s-1").getSessionId()).isEqualTo("s-1");
    }
}
