package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.PlanItemStatus;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionSpec;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable plan entry. Written only by {@link SessionStateMachine} under its lock.
 */
final class PlanItem {

    private final QuestionSpec spec;
    private Duration target;
    private PlanItemStatus status = PlanItemStatus.PENDING;
    private int followUpsIssued;
    private int exchanges;
    private Instant activatedAt;

    PlanItem(QuestionSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.target = spec.target();
    }

    String id() {
        return spec.id();
    }

    QuestionSpec spec() {
        return spec;
    }

    PlanItemStatus status() {
        return status;
    }

    boolean isPending() {
        return status == PlanItemStatus.PENDING;
    }

    int followUpsIssued() {
        return followUpsIssued;
    }

    Instant activatedAt() {
        return activatedAt;
    }

    Duration elapsed(Instant now) {
        return activatedAt == null ? Duration.ZERO : Duration.between(activatedAt, now);
    }

    void activate(Instant at) {
        if (status != PlanItemStatus.PENDING) {
            throw new IllegalStateException("Item " + id() + " is " + status + ", cannot activate");
        }
        status = PlanItemStatus.ACTIVE;
        activatedAt = at;
    }

    /** Closes the active item: answered if at least one round was recorded, otherwise skipped. */
    void close() {
        if (status == PlanItemStatus.ACTIVE) {
            status = exchanges > 0 ? PlanItemStatus.ANSWERED : PlanItemStatus.SKIPPED;
        }
    }

    void skip() {
        if (status == PlanItemStatus.PENDING) {
            status = PlanItemStatus.SKIPPED;
        }
    }

    void recordExchange() {
        exchanges++;
    }

    void recordFollowUp() {
        followUpsIssued++;
    }

    void retarget(Duration newTarget) {
        target = newTarget;
    }

    PlanItemView view() {
        return new PlanItemView(spec.id(), spec.text(), spec.type(), spec.min(), target, spec.max(),
                spec.weight(), status, followUpsIssued);
    }
}
