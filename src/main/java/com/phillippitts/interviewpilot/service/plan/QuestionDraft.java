package com.phillippitts.interviewpilot.service.plan;

import com.phillippitts.interviewpilot.domain.QuestionType;

import java.time.Duration;
import java.util.List;

/**
 * Plan item as received from a client or the matching subsystem. Any field except {@code text}
 * may be missing and is filled from configured defaults by {@link PlanDefaults}.
 */
public record QuestionDraft(
        String id,
        String text,
        QuestionType type,
        Duration min,
        Duration target,
        Duration max,
        Double weight,
        List<String> rubric
) {

    public static QuestionDraft of(String text) {
        return new QuestionDraft(null, text, null, null, null, null, null, List.of());
    }
}
