package uk.gegc.skillgrader.features.reference.application.strategy;

import uk.gegc.skillgrader.features.exercise.domain.model.Difficulty;

/**
 * @param skillCategory may be {@code null}; the cross-exercise tier then has nothing to offer
 * @param difficulty    may be {@code null}
 */
public record PoolQuery(String exerciseId, float[] embedding, String skillCategory, Difficulty difficulty) {
}
