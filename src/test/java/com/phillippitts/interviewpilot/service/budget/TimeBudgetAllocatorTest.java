package com.phillippitts.interviewpilot.service.budget;

import com.phillippitts.interviewpilot.domain.PlanItemStatus;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class TimeBudgetAllocatorTest {

    private static final Instant NOW = Instant.parse("2026-01-05T09:00:00Z");

    private final TimeBudgetAllocator allocator = new TimeBudgetAllocator();

    private static PlanItemView item(String id, long minMinutes, long maxMinutes, double weight) {
        return new PlanItemView(id, "Question " + id, QuestionType.TECHNICAL, Duration.ofMinutes(minMinutes),
                Duration.ofMinutes(minMinutes), Duration.ofMinutes(maxMinutes), weight, PlanItemStatus.PENDING, 0);
    }

    private AllocationResult allocate(List<PlanItemView> items, Duration available) {
        return allocator.allocate(items, Duration.ZERO, NOW, NOW.plus(available));
    }

    @Test
    void sharesSlackEquallyAmongEqualWeights() {
        AllocationResult result = allocate(List.of(item("q1", 3, 12, 1), item("q2", 3, 12, 1), item("q3", 3, 12, 1)),
                Duration.ofMinutes(30));

        assertThat(result.budgetExhausted()).isFalse();
        assertThat(result.budget().targets()).containsOnlyKeys("q1", "q2", "q3");
        assertThat(result.budget().targets().values()).allMatch(t -> t.equals(Duration.ofMinutes(10)));
        assertThat(result.budget().pendingFloor()).isEqualTo(Duration.ofMinutes(9));
        assertThat(result.budget().remainingItems()).isEqualTo(3);
        assertThat(result.budget().spareTime()).isEqualTo(Duration.ofMinutes(21));
    }

    @Test
    void sharesSlackByWeight() {
        AllocationResult result = allocate(List.of(item("a", 1, 30, 3), item("b", 1, 30, 1)), Duration.ofMinutes(10));

        assertThat(result.budget().targets())
                .containsEntry("a", Duration.ofMinutes(7))
                .containsEntry("b", Duration.ofMinutes(3));
    }

    @Test
    void redistributesSlackAboveItemMaximum() {
        AllocationResult result = allocate(List.of(item("short", 1, 2, 1), item("long", 1, 30, 1)),
                Duration.ofMinutes(10));

        assertThat(result.budget().targets())
                .containsEntry("short", Duration.ofMinutes(2))
                .containsEntry("long", Duration.ofMinutes(8));
    }

    @Test
    void skipsLowestWeightFirstAndLaterItemOnTie() {
        AllocationResult result = allocate(List.of(item("q1", 3, 12, 2), item("q2", 3, 12, 1), item("q3", 3, 12, 1)),
                Duration.ofMinutes(7));

        assertThat(result.budgetExhausted()).isTrue();
        assertThat(result.skipped()).containsExactly("q3");
        assertThat(result.budget().targets()).containsOnlyKeys("q1", "q2");
        assertThat(result.budget().pendingFloor()).isEqualTo(Duration.ofMinutes(6));
    }

    @Test
    void skipsEverythingWhenNoMinimumFits() {
        AllocationResult result = allocate(List.of(item("q1", 3, 12, 1), item("q2", 3, 12, 1), item("q3", 3, 12, 1)),
                Duration.ofMinutes(1));

        assertThat(result.skipped()).containsExactly("q3", "q2", "q1");
        assertThat(result.budget().targets()).isEmpty();
        assertThat(result.budget().remainingItems()).isZero();
    }

    @Test
    void reservesTimeForActiveItem() {
        AllocationResult result = allocator.allocate(List.of(item("q2", 3, 12, 1), item("q3", 3, 12, 1)),
                Duration.ofMinutes(5), NOW, NOW.plus(Duration.ofMinutes(10)));

        assertThat(result.skipped()).containsExactly("q3");
        assertThat(result.budget().remaining()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void treatsPastDeadlineAsNoTimeLeft() {
        AllocationResult result = allocator.allocate(List.of(item("q1", 1, 5, 1)), Duration.ZERO, NOW,
                NOW.minusSeconds(30));

        assertThat(result.budget().remaining()).isZero();
        assertThat(result.skipped()).containsExactly("q1");
    }

    @Test
    void emptyPlanNeedsNoSkips() {
        AllocationResult result = allocate(List.of(), Duration.ofMinutes(5));

        assertThat(result.budgetExhausted()).isFalse();
        assertThat(result.budget().targets()).isEmpty();
    }

    @Test
    void keepsMinimumsWithinAvailableTimeForRandomPlans() {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            List<PlanItemView> items = new ArrayList<>();
            int count = 1 + random.nextInt(6);
            for (int i = 0; i < count; i++) {
                long min = random.nextInt(6);
                long max = min + random.nextInt(10);
                items.add(item("q" + i, min, max, 0.5 + random.nextInt(4)));
            }
            Duration available = Duration.ofMinutes(random.nextInt(40));

            AllocationResult result = allocate(items, available);

            long floor = 0;
            long targetSum = 0;
            for (PlanItemView item : items) {
                Duration target = result.budget().targets().get(item.id());
                if (result.skipped().contains(item.id())) {
                    assertThat(target).isNull();
                    continue;
                }
                assertThat(target).isBetween(item.min(), item.max());
                floor += item.min().toMillis();
                targetSum += target.toMillis();
            }
            assertThat(floor).isLessThanOrEqualTo(available.toMillis());
            assertThat(targetSum).isLessThanOrEqualTo(available.toMillis());
        }
    }
}
