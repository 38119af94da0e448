package com.phillippitts.interviewpilot.presentation.dto;

import com.phillippitts.interviewpilot.service.session.CreateSessionCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.List;

/**
 * Body of {@code POST /api/sessions}. Without {@code plan} the plan is fetched from the matching subsystem.
 */
public record CreateSessionRequest(
        @NotBlank String candidateRef,
        @NotBlank String jobRef,
        @Valid List<QuestionItemRequest> plan,
        @Positive Long lengthSeconds
) {

    public CreateSessionCommand toCommand() {
        return new CreateSessionCommand(candidateRef, jobRef,
                plan == null ? null : plan.stream().map(QuestionItemRequest::toDraft).toList(),
                lengthSeconds == null ? null : Duration.ofSeconds(lengthSeconds));
    }
}
