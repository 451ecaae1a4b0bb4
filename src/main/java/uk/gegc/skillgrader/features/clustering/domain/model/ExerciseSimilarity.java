package uk.gegc.skillgrader.features.clustering.domain.model;

/**
 * Pairwise exercise similarity and its components, each in {@code [0, 1]}.
 */
public record ExerciseSimilarity(double overall, double content, double skill, double difficulty) {
}
