package com.phillippitts.interviewpilot.config;

import com.phillippitts.interviewpilot.config.properties.EngineProperties;
import com.phillippitts.interviewpilot.config.properties.InterviewProperties;
import com.phillippitts.interviewpilot.service.async.TimedCalls;
import com.phillippitts.interviewpilot.service.decision.AnswerScorer;
import com.phillippitts.interviewpilot.service.decision.DecisionPolicy;
import com.phillippitts.interviewpilot.service.decision.DefaultFollowUpDecisionEngine;
import com.phillippitts.interviewpilot.service.decision.FollowUpDecisionEngine;
import com.phillippitts.interviewpilot.service.decision.LexicalCoverageScorer;
import com.phillippitts.interviewpilot.service.decision.WebClientAnswerScorer;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the answer scorer from {@code interview.scoring.provider} and wires the decision engine.
 */
@Configuration
public class DecisionConfig {

    @Bean
    public AnswerScorer answerScorer(InterviewProperties properties,
                                     EngineProperties engines,
                                     @Qualifier("scoringWebClient") WebClient scoringWebClient) {
        return switch (properties.getScoring().getProvider()) {
            case LEXICAL -> new LexicalCoverageScorer();
            case REMOTE -> new WebClientAnswerScorer(scoringWebClient, engines.getScoring().getPath(),
                    engines.getScoring().getName());
        };
    }

    @Bean
    public FollowUpDecisionEngine followUpDecisionEngine(AnswerScorer answerScorer,
                                                         InterviewProperties properties,
                                                         TimedCalls timedCalls,
                                                         InterviewMetricsPublisher metrics) {
        return new DefaultFollowUpDecisionEngine(answerScorer, DecisionPolicy.from(properties), timedCalls, metrics);
    }
}
