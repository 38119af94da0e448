package com.phillippitts.interviewpilot.service.session.event;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Emitted when the allocator skipped pending items because their minimums no longer fit.
 *
 * @param sessionId      affected session
 * @param skippedItemIds items marked skipped
 * @param remaining      time left until the deadline at the time of allocation
 * @param timestamp      when the allocation ran
 */
public record BudgetExhaustedEvent(
        String sessionId,
        List<String> skippedItemIds,
        Duration remaining,
        Instant timestamp
) {}
