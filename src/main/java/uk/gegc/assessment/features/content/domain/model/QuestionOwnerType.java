package uk.gegc.assessment.features.content.domain.model;

public enum QuestionOwnerType {
    TEST,
    DRAFT
}
