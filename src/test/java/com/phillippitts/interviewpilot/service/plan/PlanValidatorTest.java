package com.phillippitts.interviewpilot.service.plan;

import com.phillippitts.interviewpilot.domain.QuestionSpec;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PlanValidatorTest {

    private static QuestionSpec spec(String id, String text, long min, long target, long max, double weight) {
        return new QuestionSpec(id, text, null, Duration.ofMinutes(min), Duration.ofMinutes(target),
                Duration.ofMinutes(max), weight, List.of());
    }

    @Test
    void acceptsWellFormedPlan() {
        assertThatCode(() -> PlanValidator.validate(List.of(spec("q1", "Intro", 1, 2, 3, 1.0),
                spec("q2", "Design", 0, 0, 0, 0.5)))).doesNotThrowAnyException();
    }

    @Test
    void rejectsEmptyPlan() {
        assertThatThrownBy(() -> PlanValidator.validate(List.of()))
                .isInstanceOf(InvalidPlanException.class)
                .hasMessageContaining("must not be empty");
        assertThatThrownBy(() -> PlanValidator.validate(null)).isInstanceOf(InvalidPlanException.class);
    }

    @Test
    void collectsAllViolations() {
        List<QuestionSpec> plan = List.of(
                spec("q1", "Intro", 5, 5, 3, 1.0),
                spec("q1", " ", 1, 2, 3, 1.0),
                spec("q3", "Design", 1, 9, 3, 0.0));

        InvalidPlanException e = catchThrowableOfType(() -> PlanValidator.validate(plan), InvalidPlanException.class);

        assertThat(e.getViolations()).containsExactly(
                "q1: min PT5M exceeds max PT3M",
                "q1: duplicate id",
                "q1: text must not be blank",
                "q3: target PT9M outside [min, max]",
                "q3: weight must be positive");
        assertThat(e.getMessage()).startsWith("Invalid question plan: ");
    }

    @Test
    void rejectsNegativeDurationsAndNonFiniteWeights() {
        QuestionSpec negative = new QuestionSpec("q1", "Intro", null, Duration.ofMinutes(-1), Duration.ZERO,
                Duration.ofMinutes(1), Double.POSITIVE_INFINITY, List.of());

        InvalidPlanException e = catchThrowableOfType(() -> PlanValidator.validate(List.of(negative)),
                InvalidPlanException.class);

        assertThat(e.getViolations()).contains("q1: durations must not be negative", "q1: weight must be positive");
    }
}
