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
@Table(name = "questions", indexes = {
        @Index(name = "idx_questions_test_id", columnList = "test_id"),
        @Index(name = "idx_questions_draft_id", columnList = "draft_id")
})
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "owner_type", nullable = false, length = 10)
    private QuestionOwnerType ownerType;

    /**
     * Owning test for {@link QuestionOwnerType#TEST}; for draft questions this is lineage
     * back to the published test being edited and may be {@code null}.
     */
    @Column(name = "test_id")
    private UUID testId;

    @Column(name = "draft_id")
    private UUID draftId;

    @Column(name = "text_of_question", nullable = false, columnDefinition = "TEXT")
    private String textOfQuestion;

    @Column(name = "sort_order")
    private Integer sortOrder;

    public static Question ownedByTest(UUID testId, String text, Integer sortOrder) {
        Question question = new Question();
        question.setOwnerType(QuestionOwnerType.TEST);
        question.setTestId(testId);
        question.setTextOfQuestion(text);
        question.setSortOrder(sortOrder);
        return question;
    }

    public static Question ownedByDraft(UUID draftId, UUID lineageTestId, String text, Integer sortOrder) {
        Question question = new Question();
        question.setOwnerType(QuestionOwnerType.DRAFT);
        question.setDraftId(draftId);
        question.setTestId(lineageTestId);
        question.setTextOfQuestion(text);
        question.setSortOrder(sortOrder);
        return question;
    }
}
