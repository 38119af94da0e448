package com.phillippitts.interviewpilot.service.plan;

import java.util.List;

/**
 * Supplies the initial question plan for a candidate and a job.
 */
public interface QuestionPlanSource {

    /**
     * Fetches the plan synchronously.
     *
     * @param candidateRef candidate reference
     * @param jobRef       job reference
     * @return drafts in delivery order; may be empty, which is rejected when the session starts
     * @throws com.phillippitts.interviewpilot.exception.InvalidPlanException if the source answers
     *         with something that is not a plan
     */
    List<QuestionDraft> fetchPlan(String candidateRef, String jobRef);
}
