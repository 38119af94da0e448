package com.phillippitts.interviewpilot.config.orchestration;

import com.phillippitts.interviewpilot.config.properties.EngineProperties;
import com.phillippitts.interviewpilot.config.properties.InterviewProperties;
import com.phillippitts.interviewpilot.service.budget.TimeBudgetAllocator;
import com.phillippitts.interviewpilot.service.clock.InterviewClock;
import com.phillippitts.interviewpilot.service.decision.FollowUpDecisionEngine;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import com.phillippitts.interviewpilot.service.plan.PlanDefaults;
import com.phillippitts.interviewpilot.service.plan.QuestionPlanSource;
import com.phillippitts.interviewpilot.service.plan.WebClientQuestionPlanSource;
import com.phillippitts.interviewpilot.service.session.ConductorSettings;
import com.phillippitts.interviewpilot.service.session.InterviewSessionService;
import com.phillippitts.interviewpilot.service.session.SessionDependencies;
import com.phillippitts.interviewpilot.service.session.SessionRegistry;
import com.phillippitts.interviewpilot.service.speech.SpeechIoAdapter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.Executor;

/**
 * Wires the session registry and the session service.
 */
@Configuration
public class SessionConfig {

    private final InterviewProperties interviewProperties;

    public SessionConfig(InterviewProperties interviewProperties) {
        this.interviewProperties = interviewProperties;
    }

    @Bean
    public TimeBudgetAllocator timeBudgetAllocator() {
        return new TimeBudgetAllocator();
    }

    @Bean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry(interviewProperties.getArchiveSize());
    }

    @Bean
    public QuestionPlanSource questionPlanSource(@Qualifier("planSourceWebClient") WebClient webClient,
                                                 EngineProperties engines) {
        EngineProperties.Endpoint endpoint = engines.getPlanSource();
        return new WebClientQuestionPlanSource(webClient, endpoint.getPath(), endpoint.getTimeout());
    }

    @Bean
    public SessionDependencies sessionDependencies(SpeechIoAdapter speechIoAdapter,
                                                   FollowUpDecisionEngine followUpDecisionEngine,
                                                   TimeBudgetAllocator timeBudgetAllocator,
                                                   InterviewClock interviewClock,
                                                   @Qualifier("sessionExecutor") Executor sessionExecutor,
                                                   ApplicationEventPublisher publisher,
                                                   InterviewMetricsPublisher metrics) {
        return new SessionDependencies(speechIoAdapter, followUpDecisionEngine, timeBudgetAllocator, interviewClock,
                sessionExecutor, publisher, metrics);
    }

    @Bean(destroyMethod = "shutdown")
    public InterviewSessionService interviewSessionService(SessionRegistry sessionRegistry,
                                                           SessionDependencies sessionDependencies,
                                                           QuestionPlanSource questionPlanSource) {
        return new InterviewSessionService(sessionRegistry, sessionDependencies, questionPlanSource,
                PlanDefaults.from(interviewProperties.getItem()), ConductorSettings.from(interviewProperties),
                interviewProperties.getDeadline(), interviewProperties.getFollowUp().getMaxDepth());
    }
}
