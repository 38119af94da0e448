package com.phillippitts.interviewpilot.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable definition of one plan item as produced by the matching subsystem.
 *
 * <p>Time bounds are not range-checked here; a plan with {@code min > max} is rejected as a whole
 * when the session starts.
 *
 * @param id     stable identifier, unique within a plan
 * @param text   question text delivered to the candidate
 * @param type   question kind
 * @param min    minimum time the item should receive
 * @param target planned time, later overwritten by budget allocation
 * @param max    hard per-item cap
 * @param weight relative share of slack time; also the skip priority (lower is skipped first)
 * @param rubric expected key points used to score coverage (may be empty)
 */
public record QuestionSpec(
        String id,
        String text,
        QuestionType type,
        Duration min,
        Duration target,
        Duration max,
        double weight,
        List<String> rubric
) {

    public QuestionSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(min, "min must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(max, "max must not be null");
        type = type == null ? QuestionType.TECHNICAL : type;
        rubric = rubric == null ? List.of() : List.copyOf(rubric);
    }
}
