package uk.gegc.assessment.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "answers", indexes = @Index(name = "idx_answers_question_id", columnList = "question_id"))
public class Answer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @Column(name = "text", nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(name = "score", nullable = false)
    private Integer score;

    @Column(name = "sort_order")
    private Integer sortOrder;

    public Answer(UUID questionId, String text, Integer score, Integer sortOrder) {
        this.questionId = questionId;
        this.text = text;
        this.score = score;
        this.sortOrder = sortOrder;
    }

    public boolean isCorrect() {
        return score != null && score > 0;
    }
}
