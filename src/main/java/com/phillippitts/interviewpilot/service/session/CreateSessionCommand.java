package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.service.plan.QuestionDraft;

import java.time.Duration;
import java.util.List;

/**
 * Request to create a session.
 *
 * @param candidateRef candidate reference
 * @param jobRef       job reference
 * @param plan         inline plan; when {@code null} the plan is fetched from the plan source
 * @param length       interview length; {@code null} uses the configured deadline
 */
public record CreateSessionCommand(String candidateRef, String jobRef, List<QuestionDraft> plan, Duration length) {
}
