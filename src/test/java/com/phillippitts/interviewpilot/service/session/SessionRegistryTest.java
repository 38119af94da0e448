package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.exception.SessionNotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry(2);

    private static LiveSession session(String id) {
        InterviewConductor conductor = mock(InterviewConductor.class);
        when(conductor.getSessionId()).thenReturn(id);
        return new LiveSession(conductor, Duration.ofMinutes(30));
    }

    private static SessionSummary terminated(String id) {
        return new SessionSummary(id, "cand", "job", SessionPhase.COMPLETED, null, null, null,
                List.of(), List.of(), List.of(), List.of(), List.of(), null, false);
    }

    @Test
    void registersAndFindsLiveSessions() {
        LiveSession s1 = session("s1");
        registry.register(s1);

        assertThat(registry.find("s1")).contains(s1);
        assertThat(registry.require("s1")).isSameAs(s1);
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.live()).containsExactly(s1);
    }

    @Test
    void rejectsDuplicateIds() {
        registry.register(session("s1"));

        assertThatThrownBy(() -> registry.register(session("s1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("s1");
    }

    @Test
    void requireThrowsForUnknownSession() {
        assertThatThrownBy(() -> registry.require("missing"))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessage("Session not found: missing");
    }

    @Test
    void archiveMovesSessionOutOfLiveMap() {
        registry.register(session("s1"));

        registry.archive(terminated("s1"));

        assertThat(registry.find("s1")).isEmpty();
        assertThat(registry.findArchived("s1")).map(SessionSummary::phase).contains(SessionPhase.COMPLETED);
    }

    @Test
    void archiveEvictsOldestSummaryWhenFull() {
        registry.archive(terminated("a"));
        registry.archive(terminated("b"));
        registry.archive(terminated("c"));

        assertThat(registry.archived()).extracting(SessionSummary::sessionId).containsExactly("b", "c");
        assertThat(registry.findArchived("a")).isEmpty();
    }

    @Test
    void archiveSizeMustBePositive() {
        assertThatThrownBy(() -> new SessionRegistry(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
