package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.config.properties.InterviewProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for follow-up decisions.
 *
 * @param coverageThreshold coverage at or above which the answer is accepted
 * @param maxDepth          follow-ups allowed per item
 * @param minCost           smallest time a follow-up round is worth
 * @param scoringTimeout    bound on one scoring call
 */
public record DecisionPolicy(double coverageThreshold, int maxDepth, Duration minCost, Duration scoringTimeout) {

    public DecisionPolicy {
        if (coverageThreshold < 0.0 || coverageThreshold > 1.0) {
            throw new IllegalArgumentException("coverageThreshold in [0,1]");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative");
        }
        Objects.requireNonNull(minCost, "minCost must not be null");
        Objects.requireNonNull(scoringTimeout, "scoringTimeout must not be null");
    }

    public static DecisionPolicy from(InterviewProperties properties) {
        InterviewProperties.FollowUp followUp = properties.getFollowUp();
        return new DecisionPolicy(followUp.getCoverageThreshold(), followUp.getMaxDepth(),
                followUp.getMinCost(), properties.getTimeouts().getScoring());
    }
}
