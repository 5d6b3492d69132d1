package uk.gegc.assessment.features.attempt.application;

public enum AnswerRecordResult {
    RECORDED,
    /** The question already had answers; the submission was dropped. */
    IGNORED
}
