package uk.gegc.assessment.features.attempt.application.impl;

import uk.gegc.assessment.features.attempt.domain.model.AttemptAnswerEntry;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Submitted answers after normalisation: null ids dropped, duplicates collapsed keeping the first
 * occurrence with its point. Points that do not line up with the ids are replaced by zeros and
 * the earned points reset to 0; texts that do not line up are dropped.
 */
record AnswerSelection(List<UUID> answerIds, List<String> answerTexts, List<Integer> answerPoints, int earnedPoints) {

    static AnswerSelection normalise(List<UUID> answerIds, List<String> answerTexts,
                                     List<Integer> answerPoints, Integer earnedPoints) {
        if (answerIds == null || answerIds.isEmpty()) {
            throw new ValidationException("At least one answer id is required");
        }
        if (answerPoints != null && answerPoints.stream().anyMatch(point -> point != null && point < 0)) {
            throw new ValidationException("Answer points cannot be negative");
        }
        if (earnedPoints != null && earnedPoints < 0) {
            throw new ValidationException("Earned points cannot be negative");
        }

        boolean pointsAligned = answerPoints != null && answerPoints.size() == answerIds.size();
        boolean textsAligned = answerTexts != null && answerTexts.size() == answerIds.size();

        Set<UUID> seen = new LinkedHashSet<>();
        List<String> texts = new ArrayList<>();
        List<Integer> points = new ArrayList<>();
        for (int i = 0; i < answerIds.size(); i++) {
            UUID id = answerIds.get(i);
            if (id == null || !seen.add(id)) {
                continue;
            }
            if (textsAligned) {
                texts.add(answerTexts.get(i));
            }
            if (pointsAligned) {
                Integer point = answerPoints.get(i);
                points.add(point != null ? point : 0);
            }
        }
        if (seen.isEmpty()) {
            throw new ValidationException("At least one answer id is required");
        }

        List<UUID> ids = new ArrayList<>(seen);
        if (!pointsAligned) {
            return new AnswerSelection(ids, texts, new ArrayList<>(Collections.nCopies(ids.size(), 0)), 0);
        }
        int earned = earnedPoints != null ? earnedPoints : points.stream().mapToInt(Integer::intValue).sum();
        return new AnswerSelection(ids, texts, points, earned);
    }

    void applyTo(AttemptAnswerEntry entry) {
        entry.setAnswerIds(new ArrayList<>(answerIds));
        entry.setAnswerTexts(new ArrayList<>(answerTexts));
        entry.setAnswerPoints(new ArrayList<>(answerPoints));
        entry.setEarnedPoints(earnedPoints);
    }
}
