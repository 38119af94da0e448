package com.phillippitts.interviewpilot.presentation.dto;

import com.phillippitts.interviewpilot.domain.QuestionType;
import com.phillippitts.interviewpilot.service.plan.QuestionDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;
import java.util.List;

/**
 * Plan item in a REST request. Missing fields fall back to the configured item defaults.
 */
public record QuestionItemRequest(
        String id,
        @NotBlank String text,
        QuestionType type,
        @PositiveOrZero Long minSeconds,
        @PositiveOrZero Long targetSeconds,
        @PositiveOrZero Long maxSeconds,
        @Positive Double weight,
        List<String> rubric
) {

    public QuestionDraft toDraft() {
        return new QuestionDraft(id, text, type, seconds(minSeconds), seconds(targetSeconds), seconds(maxSeconds),
                weight, rubric == null ? List.of() : rubric);
    }

    private static Duration seconds(Long value) {
        return value == null ? null : Duration.ofSeconds(value);
    }
}
