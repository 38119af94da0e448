package com.phillippitts.interviewpilot.service.decision;

import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.QuestionType;
import com.phillippitts.interviewpilot.exception.ScoringException;
import com.phillippitts.interviewpilot.service.async.CancellationScope;
import com.phillippitts.interviewpilot.service.async.TimedCalls;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetrics;
import com.phillippitts.interviewpilot.service.metrics.InterviewMetricsPublisher;
import com.phillippitts.interviewpilot.testutil.ManualClock;
import com.phillippitts.interviewpilot.testutil.ScriptedScorer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultFollowUpDecisionEngineTest {

    private static final Duration SCORING_TIMEOUT = Duration.ofSeconds(5);

    private ManualClock clock;
    private ScriptedScorer scorer;
    private MeterRegistry registry;
    private CancellationScope scope;
    private DefaultFollowUpDecisionEngine engine;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        scorer = new ScriptedScorer();
        registry = new SimpleMeterRegistry();
        scope = new CancellationScope("session-1");
        engine = engine(scorer, 2);
    }

    private DefaultFollowUpDecisionEngine engine(AnswerScorer answerScorer, int maxDepth) {
        DecisionPolicy policy = new DecisionPolicy(0.7, maxDepth, Duration.ofSeconds(60), SCORING_TIMEOUT);
        return new DefaultFollowUpDecisionEngine(answerScorer, policy, new TimedCalls(clock),
                new InterviewMetricsPublisher(new InterviewMetrics(registry)));
    }

    private DecisionRequest request(String transcript, int followUps, Duration itemElapsed) {
        BudgetState budget = new BudgetState(clock.now(), Duration.ofMinutes(20), 2, Duration.ofMinutes(6), Map.of());
        return new DecisionRequest("q1", "Describe a system you designed", "Describe a system you designed",
                transcript, List.of("caching", "sharding"), QuestionType.TECHNICAL, itemElapsed,
                Duration.ofMinutes(10), followUps, budget, clock.now());
    }

    @Test
    void forceAdvancesWhenNoAnswer() {
        Decision decision = engine.decide(request("", 0, Duration.ofMinutes(1)), scope).join();

        assertThat(decision).isEqualTo(Decision.forceAdvance("no-answer"));
        assertThat(scorer.requests).isEmpty();
    }

    @Test
    void forceAdvancesWhenItemCapLeavesNoRoomForAnotherRound() {
        scorer.partial(0.1, List.of("sharding"));

        Decision decision = engine.decide(request("some answer", 0, Duration.ofSeconds(570)), scope).join();

        assertThat(decision).isEqualTo(Decision.forceAdvance("budget"));
        assertThat(scorer.requests).isEmpty();
    }

    @Test
    void forceAdvancesWhenPendingMinimumsLeaveNoRoom() {
        BudgetState tight = new BudgetState(clock.now(), Duration.ofMinutes(6), 2, Duration.ofMinutes(6), Map.of());
        DecisionRequest request = new DecisionRequest("q1", "Q", "Q", "answer", List.of(), QuestionType.TECHNICAL,
                Duration.ZERO, Duration.ofMinutes(10), 0, tight, clock.now());

        assertThat(engine.decide(request, scope).join()).isEqualTo(Decision.forceAdvance("budget"));
    }

    @Test
    void advancesWithoutScoringWhenDepthExhausted() {
        Decision decision = engine.decide(request("answer", 2, Duration.ofMinutes(1)), scope).join();

        assertThat(decision).isEqualTo(Decision.advance("depth-exhausted"));
        assertThat(scorer.requests).isEmpty();
    }

    @Test
    void advancesWhenCoverageMeetsThreshold() {
        scorer.partial(0.7, List.of());

        Decision decision = engine.decide(request("caching and sharding", 0, Duration.ofMinutes(1)), scope).join();

        assertThat(decision).isEqualTo(Decision.advance("covered"));
        assertThat(scorer.requests.get(0).rubric()).containsExactly("caching", "sharding");
    }

    @Test
    void followsUpOnFirstMissingPoint() {
        scorer.partial(0.5, List.of("sharding", "caching"));

        Decision decision = engine.decide(request("caching", 0, Duration.ofMinutes(1)), scope).join();

        assertThat(decision).isEqualTo(Decision.followUp("Could you say more about sharding?"));
    }

    @Test
    void prefersScorerFollowUpText() {
        AnswerScorer remote = mock(AnswerScorer.class);
        when(remote.getName()).thenReturn("remote");
        when(remote.score(any())).thenReturn(CompletableFuture.completedFuture(
                new ScoringResult(0.2, "How would you shard the user table?", List.of("sharding"))));

        Decision decision = engine(remote, 2).decide(request("caching", 0, Duration.ofMinutes(1)), scope).join();

        assertThat(decision).isEqualTo(Decision.followUp("How would you shard the user table?"));
    }

    @Test
    void usesTypeSpecificPromptWithoutMissingPoints() {
        scorer.partial(0.1, List.of());

        Decision decision = engine.decide(request("short", 0, Duration.ofMinutes(1)), scope).join();

        assertThat(decision.kind()).isEqualTo(Decision.Kind.FOLLOW_UP);
        assertThat(((Decision.FollowUp) decision).text()).isEqualTo(FollowUpPrompts.build(QuestionType.TECHNICAL,
                List.of()));
    }

    @Test
    void advancesWhenScoringTimesOut() {
        scorer.hang();

        CompletableFuture<Decision> decision = engine.decide(request("answer", 0, Duration.ofMinutes(1)), scope);
        assertThat(decision).isNotDone();

        clock.advance(SCORING_TIMEOUT);

        assertThat(decision.join()).isEqualTo(Decision.advance("scoring-unavailable"));
        assertThat(registry.find("interviewpilot.scoring.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void advancesWhenScorerFails() {
        AnswerScorer broken = mock(AnswerScorer.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.score(any())).thenReturn(CompletableFuture.failedFuture(new ScoringException("HTTP 500", false)));

        Decision decision = engine(broken, 2).decide(request("answer", 0, Duration.ofMinutes(1)), scope).join();

        assertThat(decision).isEqualTo(Decision.advance("scoring-unavailable"));
        assertThat(registry.find("interviewpilot.scoring.failure").tag("reason", "error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void propagatesCancellation() {
        scorer.hang();
        CompletableFuture<Decision> decision = engine.decide(request("answer", 0, Duration.ofMinutes(1)), scope);

        scope.cancelAll();

        assertThatThrownBy(decision::join).hasCauseInstanceOf(CancellationException.class);
        assertThat(registry.find("interviewpilot.scoring.failure").counter()).isNull();
    }

    @Test
    void buildsPromptsForEveryQuestionType() {
        for (QuestionType type : QuestionType.values()) {
            assertThat(FollowUpPrompts.build(type, null)).isNotBlank().endsWith("?");
        }
        assertThat(FollowUpPrompts.build(QuestionType.BEHAVIORAL, List.of(" conflict resolution ")))
                .isEqualTo("Could you say more about conflict resolution?");
    }
}
