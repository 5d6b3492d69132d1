package uk.gegc.assessment.features.attempt.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The answers document stored in {@link TestAttempt#getAttemptVersion()}. Entries are keyed by
 * question id and keep the order they were initialised in.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"attemptNo", "testTitle", "minPoint", "answers"})
public class AttemptVersion {

    private Integer attemptNo;
    private String testTitle;
    private Integer minPoint;
    private List<AttemptAnswerEntry> answers = new ArrayList<>();

    public AttemptVersion(Integer attemptNo, String testTitle, Integer minPoint) {
        this.attemptNo = attemptNo;
        this.testTitle = testTitle;
        this.minPoint = minPoint;
    }

    public Optional<AttemptAnswerEntry> findEntry(UUID questionId) {
        return answers.stream()
                .filter(entry -> questionId.equals(entry.getQuestionId()))
                .findFirst();
    }

    /**
     * Returns the entry for the question, appending an empty one at the end if none exists.
     */
    public AttemptAnswerEntry entryFor(UUID questionId) {
        return findEntry(questionId).orElseGet(() -> {
            AttemptAnswerEntry entry = new AttemptAnswerEntry();
            entry.setQuestionId(questionId);
            answers.add(entry);
            return entry;
        });
    }
}
