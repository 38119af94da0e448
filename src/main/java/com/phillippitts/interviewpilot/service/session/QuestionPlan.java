package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.PlanItemStatus;
import com.phillippitts.interviewpilot.domain.PlanItemView;
import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.domain.SessionPhase;
import com.phillippitts.interviewpilot.exception.IllegalSessionStateException;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, mutable question plan of one session.
 *
 * <p>Only pending items can be removed or moved. At most one item is {@code ACTIVE}.
 * Not thread-safe; guarded by the owning state machine's lock.
 */
final class QuestionPlan {

    private final List<PlanItem> items = new ArrayList<>();

    QuestionPlan(List<QuestionSpec> specs) {
        for (QuestionSpec spec : specs) {
            items.add(new PlanItem(spec));
        }
    }

    Optional<PlanItem> active() {
        return items.stream().filter(i -> i.status() == PlanItemStatus.ACTIVE).findFirst();
    }

    Optional<PlanItem> nextPending() {
        return items.stream().filter(PlanItem::isPending).findFirst();
    }

    Optional<PlanItem> find(String id) {
        return items.stream().filter(i -> i.id().equals(id)).findFirst();
    }

    List<PlanItem> pending() {
        return items.stream().filter(PlanItem::isPending).toList();
    }

    List<PlanItemView> pendingViews() {
        return items.stream().filter(PlanItem::isPending).map(PlanItem::view).toList();
    }

    List<QuestionSpec> specs() {
        return items.stream().map(PlanItem::spec).toList();
    }

    List<PlanItemView> views() {
        return items.stream().map(PlanItem::view).toList();
    }

    void append(QuestionSpec spec) {
        if (find(spec.id()).isPresent()) {
            throw new InvalidPlanException("Duplicate plan item id: " + spec.id());
        }
        items.add(new PlanItem(spec));
    }

    void remove(String id, SessionPhase phase) {
        PlanItem item = requirePending(id, phase);
        items.remove(item);
    }

    void move(String id, int index, SessionPhase phase) {
        PlanItem item = requirePending(id, phase);
        if (index < 0 || index >= items.size()) {
            throw new IllegalArgumentException("index out of range: " + index);
        }
        items.remove(item);
        items.add(index, item);
    }

    private PlanItem requirePending(String id, SessionPhase phase) {
        PlanItem item = find(id).orElseThrow(() -> new IllegalArgumentException("Unknown plan item: " + id));
        if (!item.isPending()) {
            throw new IllegalSessionStateException("Plan item " + id + " is " + item.status(), phase);
        }
        return item;
    }
}
