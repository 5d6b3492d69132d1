package uk.gegc.assessment.features.attempt.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AnswerSelection normalisation")
class AnswerSelectionTest {

    private final UUID a = UUID.randomUUID();
    private final UUID b = UUID.randomUUID();

    @Test
    @DisplayName("duplicates keep the first occurrence and its point")
    void duplicates_keepFirst() {
        AnswerSelection selection = AnswerSelection.normalise(
                List.of(a, b, a), List.of("A", "B", "A again"), List.of(2, 1, 5), null);

        assertThat(selection.answerIds()).containsExactly(a, b);
        assertThat(selection.answerTexts()).containsExactly("A", "B");
        assertThat(selection.answerPoints()).containsExactly(2, 1);
        assertThat(selection.earnedPoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("points of a different length are zeroed and earned points reset")
    void misalignedPoints_zeroed() {
        AnswerSelection selection = AnswerSelection.normalise(List.of(a, b), null, List.of(4), 4);

        assertThat(selection.answerPoints()).containsExactly(0, 0);
        assertThat(selection.earnedPoints()).isZero();
        assertThat(selection.answerTexts()).isEmpty();
    }

    @Test
    @DisplayName("explicit earned points win over the point sum")
    void explicitEarned() {
        assertThat(AnswerSelection.normalise(List.of(a), null, List.of(2), 1).earnedPoints()).isEqualTo(1);
    }

    @Test
    @DisplayName("empty, all-null and negative input is rejected")
    void invalidInput() {
        assertThatThrownBy(() -> AnswerSelection.normalise(List.of(), null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("At least one answer id is required");
        assertThatThrownBy(() -> AnswerSelection.normalise(Arrays.asList(null, null), null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> AnswerSelection.normalise(List.of(a), null, List.of(-1), null))
                .hasMessage("Answer points cannot be negative");
        assertThatThrownBy(() -> AnswerSelection.normalise(List.of(a), null, List.of(1), -2))
                .hasMessage("Earned points cannot be negative");
    }
}
