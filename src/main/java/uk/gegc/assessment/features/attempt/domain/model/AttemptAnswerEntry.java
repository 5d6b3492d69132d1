package uk.gegc.assessment.features.attempt.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One question of an attempt together with the answers the student chose.
 * {@code answerIds} and {@code answerPoints} always have the same length; {@code answerTexts}
 * is either empty or of that length too.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"order", "questionId", "questionText", "maxPoints",
        "answerIds", "answerTexts", "answerPoints", "earnedPoints"})
public class AttemptAnswerEntry {

    private Integer order;
    private UUID questionId;
    private String questionText;
    private Integer maxPoints;
    private List<UUID> answerIds = new ArrayList<>();
    private List<String> answerTexts = new ArrayList<>();
    private List<Integer> answerPoints = new ArrayList<>();
    private int earnedPoints;

    // Single-answer field of older documents; read only.
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @JsonProperty(value = "answerId", access = JsonProperty.Access.WRITE_ONLY)
    private UUID legacyAnswerId;

    public static AttemptAnswerEntry unanswered(Integer order, UUID questionId, String questionText, Integer maxPoints) {
        AttemptAnswerEntry entry = new AttemptAnswerEntry();
        entry.setOrder(order);
        entry.setQuestionId(questionId);
        entry.setQuestionText(questionText);
        entry.setMaxPoints(maxPoints);
        return entry;
    }

    public boolean hasAnswers() {
        return !answerIds.isEmpty();
    }

    /**
     * Replaces nulls left by older or hand-edited documents and folds the legacy single
     * {@code answerId} into {@code answerIds}.
     */
    public void normalise() {
        if (answerIds == null) {
            answerIds = new ArrayList<>();
        }
        if (answerTexts == null) {
            answerTexts = new ArrayList<>();
        }
        if (answerPoints == null) {
            answerPoints = new ArrayList<>();
        }
        if (legacyAnswerId != null && answerIds.isEmpty()) {
            answerIds.add(legacyAnswerId);
        }
        legacyAnswerId = null;
        if (answerPoints.size() != answerIds.size()) {
            answerPoints = new ArrayList<>(Collections.nCopies(answerIds.size(), 0));
        }
        if (!answerTexts.isEmpty() && answerTexts.size() != answerIds.size()) {
            answerTexts = new ArrayList<>();
        }
    }
}
