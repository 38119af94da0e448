package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.domain.QuestionType;

import java.util.List;

/**
 * Builds follow-up questions when the scorer does not propose one.
 */
final class FollowUpPrompts {

    private FollowUpPrompts() {
    }

    static String build(QuestionType type, List<String> missingPoints) {
        if (missingPoints != null && !missingPoints.isEmpty()) {
            String point = missingPoints.get(0).trim();
            return "Could you say more about " + point + "?";
        }
        return switch (type) {
            case BEHAVIORAL -> "What was the outcome, and what would you do differently next time?";
            case SITUATIONAL -> "How would you handle it if the first approach did not work?";
            case CULTURAL -> "Can you give a concrete example of that from your own experience?";
            case TECHNICAL -> "Can you walk me through a concrete example, including the trade-offs involved?";
        };
    }
}
