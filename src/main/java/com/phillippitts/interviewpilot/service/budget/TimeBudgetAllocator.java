package com.phillippitts.interviewpilot.service.budget;

import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.PlanItemView;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Redistributes the remaining interview time across pending plan items.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>{@code available = (deadline - now) - activeReserve}, never negative</li>
 *   <li>While the pending minimums exceed {@code available}, skip the lowest-weight item
 *       (on equal weight, the later one in plan order)</li>
 *   <li>{@code slack = available - sum(minimums)} is shared by weight; an item never receives more
 *       than its maximum and the excess is redistributed among the remaining items</li>
 * </ol>
 *
 * <p>After every run {@code sum(pending minimums) <= available}. The allocator is a pure function:
 * it reads snapshots and returns a result that the session state machine applies.
 */
public final class TimeBudgetAllocator {

    /**
     * Computes new targets for pending items.
     *
     * @param pending       pending items in plan order
     * @param activeReserve time still owed to the item currently in progress, or zero
     * @param now           current time
     * @param deadline      global deadline
     * @return budget snapshot and the ids of items to skip
     */
    public AllocationResult allocate(List<PlanItemView> pending, Duration activeReserve, Instant now, Instant deadline) {
        Objects.requireNonNull(pending, "pending must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");

        Duration remaining = nonNegative(Duration.between(now, deadline));
        long availableMs = Math.max(0, remaining.toMillis()
                - (activeReserve == null ? 0 : Math.max(0, activeReserve.toMillis())));

        List<PlanItemView> survivors = new ArrayList<>(pending);
        List<String> skipped = new ArrayList<>();
        while (!survivors.isEmpty() && sumMinMillis(survivors) > availableMs) {
            PlanItemView victim = lowestPriority(survivors);
            survivors.remove(victim);
            skipped.add(victim.id());
        }

        long floorMs = sumMinMillis(survivors);
        Map<String, Duration> targets = distribute(survivors, availableMs - floorMs);
        BudgetState budget = new BudgetState(now, remaining, survivors.size(), Duration.ofMillis(floorMs), targets);
        return new AllocationResult(budget, skipped);
    }

    private static PlanItemView lowestPriority(List<PlanItemView> items) {
        PlanItemView victim = items.get(0);
        for (PlanItemView item : items) {
            // <= so that the later item loses a tie
            if (item.weight() <= victim.weight()) {
                victim = item;
            }
        }
        return victim;
    }

    private static Map<String, Duration> distribute(List<PlanItemView> items, long slackMs) {
        Map<String, Long> allocated = new LinkedHashMap<>();
        List<PlanItemView> open = new ArrayList<>();
        for (PlanItemView item : items) {
            allocated.put(item.id(), item.min().toMillis());
            if (item.max().compareTo(item.min()) > 0) {
                open.add(item);
            }
        }

        long slack = slackMs;
        while (slack > 0 && !open.isEmpty()) {
            double totalWeight = open.stream().mapToDouble(PlanItemView::weight).sum();
            List<PlanItemView> capped = new ArrayList<>();
            for (PlanItemView item : open) {
                long share = (long) Math.floor(slack * (item.weight() / totalWeight));
                if (share >= item.max().toMillis() - allocated.get(item.id())) {
                    capped.add(item);
                }
            }
            if (capped.isEmpty()) {
                for (PlanItemView item : open) {
                    long share = (long) Math.floor(slack * (item.weight() / totalWeight));
                    allocated.merge(item.id(), share, Long::sum);
                }
                break;
            }
            for (PlanItemView item : capped) {
                long room = item.max().toMillis() - allocated.get(item.id());
                allocated.put(item.id(), item.max().toMillis());
                slack -= room;
            }
            open.removeAll(capped);
        }

        Map<String, Duration> targets = new LinkedHashMap<>();
        allocated.forEach((id, ms) -> targets.put(id, Duration.ofMillis(ms)));
        return targets;
    }

    private static long sumMinMillis(List<PlanItemView> items) {
        long sum = 0;
        for (PlanItemView item : items) {
            sum += item.min().toMillis();
        }
        return sum;
    }

    private static Duration nonNegative(Duration d) {
        return d.isNegative() ? Duration.ZERO : d;
    }
}
