package com.phillippitts.interviewpilot.presentation.exception;

import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.exception.IllegalSessionStateException;
import com.phillippitts.interviewpilot.exception.InterviewPilotException;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;
import com.phillippitts.interviewpilot.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidPlanReturns400WithAllViolations() {
        InvalidPlanException ex = new InvalidPlanException("Invalid plan",
                List.of("duplicate item id: q1", "item q2 has non-positive weight"));

        ResponseEntity<?> response = handler.handleInvalidPlan(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidPlanException")
                .contains("duplicate item id: q1; item q2 has non-positive weight");
    }

    @Test
    void unknownSessionReturns404() {
        ResponseEntity<?> response = handler.handleSessionNotFound(new SessionNotFoundException("s-42"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("details=s-42");
    }

    @Test
    void outOfPhaseSignalReturns409WithPhase() {
        IllegalSessionStateException ex = new IllegalSessionStateException("pause requires a running session",
                SessionPhase.COMPLETED);

        ResponseEntity<?> response = handler.handleIllegalState(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString())
                .contains("Operation not allowed in phase COMPLETED")
                .contains("(phase: COMPLETED)");
    }

    @Test
    void unknownItemReturns404() {
        ResponseEntity<?> response = handler.handleUnknownItem(new IllegalArgumentException("Unknown item: q9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("Unknown item: q9");
    }

    @Test
    void upstreamFailureReturns503WithoutDetails() {
        InterviewPilotException ex = new InterviewPilotException("plan source http://10.0.0.5:9004 refused");

        ResponseEntity<?> response = handler.handleUpstreamFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        // Internal addresses stay in the logs
        assertThat(response.getBody().toString()).doesNotContain("10.0.0.5");
    }

    @Test
    void unexpectedErrorReturns500() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("candidate said: secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret");
    }

    @Test
    void responsesCarryTimestamp() {
        ResponseEntity<?> response = handler.handleSessionNotFound(new SessionNotFoundException("s-1"));

        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
