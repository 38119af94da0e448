package com.phillippitts.interviewpilot.exception;

import java.util.List;

/**
 * Thrown when a question plan is rejected at session start: empty plan, duplicate ids,
 * non-positive weights or an item whose minimum exceeds its maximum.
 */
public class InvalidPlanException extends InterviewPilotException {

    private final List<String> violations;

    public InvalidPlanException(String message) {
        this(message, List.of(message));
    }

    public InvalidPlanException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
