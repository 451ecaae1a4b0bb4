package uk.gegc.skillgrader.features.rubric.domain.model;

/**
 * @param adjustment signed difference between {@code score} and the claimed score
 */
public record CorrectedScore(int score, boolean wasAdjusted, int adjustment) {
}
