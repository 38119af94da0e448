package com.phillippitts.interviewpilot.service.decision;

import java.util.List;
import java.util.Optional;

/**
 * Output of an {@link AnswerScorer}.
 *
 * @param coverage      fraction of the expected content the answer covers, in {@code [0, 1]}
 * @param followUpText  follow-up proposed by the scorer, or {@code null}
 * @param missingPoints rubric points the answer did not cover
 */
public record ScoringResult(double coverage, String followUpText, List<String> missingPoints) {

    public ScoringResult {
        if (Double.isNaN(coverage)) {
            throw new IllegalArgumentException("coverage must be a number");
        }
        coverage = Math.max(0.0, Math.min(1.0, coverage));
        missingPoints = missingPoints == null ? List.of() : List.copyOf(missingPoints);
    }

    public Optional<String> followUp() {
        return followUpText == null || followUpText.isBlank() ? Optional.empty() : Optional.of(followUpText);
    }
}
