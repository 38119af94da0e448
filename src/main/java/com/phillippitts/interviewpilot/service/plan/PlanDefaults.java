package com.phillippitts.interviewpilot.service.plan;

import com.phillippitts.interviewpilot.config.properties.InterviewProperties;
import com.phillippitts.interviewpilot.domain.QuestionSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns drafts into complete {@link QuestionSpec}s using the configured per-item defaults.
 *
 * <p>Missing ids become {@code q1, q2, ...} by position. A missing target is the default target
 * clamped into the item's own {@code [min, max]}. Nothing is validated here; see
 * {@link PlanValidator}.
 */
public final class PlanDefaults {

    private final Duration min;
    private final Duration target;
    private final Duration max;
    private final double weight;

    public PlanDefaults(Duration min, Duration target, Duration max, double weight) {
        this.min = Objects.requireNonNull(min, "min must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        this.weight = weight;
    }

    public static PlanDefaults from(InterviewProperties.Item item) {
        return new PlanDefaults(item.getMin(), item.getTarget(), item.getMax(), item.getWeight());
    }

    public List<QuestionSpec> apply(List<QuestionDraft> drafts) {
        List<QuestionSpec> specs = new ArrayList<>(drafts == null ? 0 : drafts.size());
        if (drafts == null) {
            return specs;
        }
        int position = 1;
        for (QuestionDraft draft : drafts) {
            specs.add(apply(draft, position++));
        }
        return specs;
    }

    public QuestionSpec apply(QuestionDraft draft, int position) {
        String id = draft.id() == null || draft.id().isBlank() ? "q" + position : draft.id();
        String text = draft.text() == null ? "" : draft.text().trim();
        Duration itemMin = draft.min() != null ? draft.min() : min;
        Duration itemMax = draft.max() != null ? draft.max() : max;
        Duration itemTarget = draft.target() != null ? draft.target() : clamp(target, itemMin, itemMax);
        double itemWeight = draft.weight() != null ? draft.weight() : weight;
        return new QuestionSpec(id, text, draft.type(), itemMin, itemTarget, itemMax, itemWeight, draft.rubric());
    }

    private static Duration clamp(Duration value, Duration low, Duration high) {
        if (low.compareTo(high) > 0) {
            return value;
        }
        if (value.compareTo(low) < 0) {
            return low;
        }
        return value.compareTo(high) > 0 ? high : value;
    }
}
