package com.phillippitts.interviewpilot.service.plan;

import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects malformed plans before a session starts.
 *
 * <p>Rules: the plan is not empty; ids are unique; text is not blank; durations are not negative;
 * {@code min <= max}; {@code min <= target <= max}; weight is a positive finite number.
 * All violations are collected into one {@link InvalidPlanException}.
 */
public final class PlanValidator {

    private PlanValidator() {
    }

    public static void validate(List<QuestionSpec> plan) {
        if (plan == null || plan.isEmpty()) {
            throw new InvalidPlanException("Question plan must not be empty");
        }
        List<String> violations = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (QuestionSpec item : plan) {
            String id = item.id();
            if (!ids.add(id)) {
                violations.add(id + ": duplicate id");
            }
            if (item.text().isBlank()) {
                violations.add(id + ": text must not be blank");
            }
            if (item.min().isNegative() || item.max().isNegative() || item.target().isNegative()) {
                violations.add(id + ": durations must not be negative");
            }
            if (item.min().compareTo(item.max()) > 0) {
                violations.add(id + ": min " + item.min() + " exceeds max " + item.max());
            } else if (item.target().compareTo(item.min()) < 0 || item.target().compareTo(item.max()) > 0) {
                violations.add(id + ": target " + item.target() + " outside [min, max]");
            }
            if (!(item.weight() > 0.0) || Double.isInfinite(item.weight())) {
                violations.add(id + ": weight must be positive");
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidPlanException("Invalid question plan: " + String.join("; ", violations), violations);
        }
    }
}
