package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.domain.QuestionType;

import java.util.List;
import java.util.Objects;

/**
 * Input to an {@link AnswerScorer}.
 *
 * @param question   text the candidate answered
 * @param transcript the answer, never blank
 * @param rubric     expected key points of the plan item (may be empty)
 * @param type       question kind
 */
public record ScoringRequest(String question, String transcript, List<String> rubric, QuestionType type) {

    public ScoringRequest {
        Objects.requireNonNull(question, "question must not be null");
        Objects.requireNonNull(transcript, "transcript must not be null");
        rubric = rubric == null ? List.of() : List.copyOf(rubric);
    }
}
