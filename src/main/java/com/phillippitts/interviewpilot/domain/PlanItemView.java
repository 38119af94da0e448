package com.phillippitts.interviewpilot.domain;

import java.time.Duration;

/**
 * Read-only snapshot of a plan item and its current status.
 */
public record PlanItemView(
        String id,
        String text,
        QuestionType type,
        Duration min,
        Duration target,
        Duration max,
        double weight,
        PlanItemStatus status,
        int followUpsIssued
) {
}
