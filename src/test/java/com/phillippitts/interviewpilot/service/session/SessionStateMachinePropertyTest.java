package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.AbortReason;
import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.Decision;
import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.PlanItemStatus;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.domain.QuestionType;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.domain.TransitionLogEntry;
import com.phillippitts.interviewpilot.service.budget.TimeBudgetAllocator;
import com.phillippitts.interviewpilot.testutil.ManualClock;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the state machine with random but legal input and checks the properties that must hold
 * for every run.
 */
class SessionStateMachinePropertyTest {

    private static final int MAX_DEPTH = 2;
    private static final int MAX_STEPS = 2_000;

    static LongStream seeds() {
        return LongStream.rangeClosed(1, 50);
    }

    @ParameterizedTest(name = "seed {0}")
    @MethodSource("seeds")
    void randomRunsKeepSessionInvariants(long seed) {
        Random random = new Random(seed);
        ManualClock clock = new ManualClock();
        SessionStateMachine sm = new SessionStateMachine("prop-" + seed, "cand", "job", clock,
                new TimeBudgetAllocator(), MAX_DEPTH);
        List<BudgetState> budgets = new ArrayList<>();

        Instant deadline = clock.now().plus(Duration.ofMinutes(5 + random.nextInt(36)));
        budgets.add(sm.start(randomPlan(random), deadline));

        int steps = 0;
        while (!sm.phase().isTerminal() && steps++ < MAX_STEPS) {
            if (!clock.now().isBefore(deadline) && sm.phase() != SessionPhase.CLOSING) {
                sm.onDeadline();
                continue;
            }
            if (random.nextInt(100) < 2) {
                sm.abort(AbortReason.external("random abort"));
                continue;
            }
            switch (sm.phase()) {
                case GREETING, ADVANCING, CLOSING -> sm.advance();
                case DELIVERING, FOLLOWING_UP -> {
                    clock.advance(Duration.ofSeconds(random.nextInt(30)));
                    sm.onPromptDelivered();
                }
                case LISTENING -> {
                    clock.advance(Duration.ofSeconds(random.nextInt(300)));
                    if (clock.now().isBefore(deadline)) {
                        sm.onTranscript(random.nextBoolean() ? "an answer about caching" : "");
                    }
                }
                case DECIDING -> sm.applyDecision(randomDecision(random));
                default -> throw new IllegalStateException("unexpected phase " + sm.phase());
            }
            budgets.add(sm.budget());
        }

        SessionSummary summary = sm.summary();
        assertThat(summary.phase().isTerminal()).as("terminal after %d steps", steps).isTrue();

        assertThat(summary.transitions())
                .filteredOn(e -> e.isTransition() && e.to().isTerminal())
                .hasSize(1);

        assertThat(summary.items()).allSatisfy(i -> assertThat(i.followUpsIssued()).isLessThanOrEqualTo(MAX_DEPTH));

        Duration spent = summary.history().stream().map(Exchange::elapsed).reduce(Duration.ZERO, Duration::plus);
        assertThat(spent).isLessThanOrEqualTo(Duration.between(summary.startedAt(), summary.endedAt()));

        List<TransitionLogEntry> log = summary.transitions();
        for (int i = 1; i < log.size(); i++) {
            assertThat(log.get(i).at()).isAfterOrEqualTo(log.get(i - 1).at());
            assertThat(log.get(i).sequence()).isGreaterThan(log.get(i - 1).sequence());
        }

        assertThat(summary.items()).noneMatch(i -> i.status() == PlanItemStatus.ACTIVE);
        if (summary.phase() == SessionPhase.COMPLETED) {
            assertThat(summary.items()).noneMatch(i -> i.status() == PlanItemStatus.PENDING);
        }

        for (PlanItemView item : summary.items()) {
            boolean hasExchanges = summary.history().stream().anyMatch(e -> e.itemId().equals(item.id()));
            assertThat(item.status() == PlanItemStatus.ANSWERED).as("item %s", item.id()).isEqualTo(hasExchanges);
        }

        assertThat(budgets).allSatisfy(b -> assertThat(b.pendingFloor()).isLessThanOrEqualTo(b.remaining()));
    }

    private static List<QuestionSpec> randomPlan(Random random) {
        int size = 1 + random.nextInt(5);
        List<QuestionSpec> plan = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            int min = 1 + random.nextInt(4);
            int max = min + random.nextInt(9);
            double weight = 0.5 + random.nextInt(6) * 0.5;
            plan.add(new QuestionSpec("q" + i, "Question " + i + "?", QuestionType.TECHNICAL,
                    Duration.ofMinutes(min), Duration.ofMinutes(min), Duration.ofMinutes(max), weight, List.of()));
        }
        return plan;
    }

    private static Decision randomDecision(Random random) {
        int roll = random.nextInt(3);
        if (roll == 0) {
            return Decision.followUp("Can you go deeper?");
        }
        return roll == 1 ? Decision.advance("covered") : Decision.forceAdvance("item-limit");
    }
}
