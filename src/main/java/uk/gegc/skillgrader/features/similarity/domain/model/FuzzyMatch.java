package uk.gegc.skillgrader.features.similarity.domain.model;

import java.util.Optional;

/**
 * Outcome of matching a free-form label against a pool of canonical labels.
 *
 * @param match          best pool entry, or {@code null} when nothing cleared the threshold
 * @param bestSimilarity highest effective similarity observed, even when below the threshold
 */
public record FuzzyMatch(String match, double bestSimilarity) {

    public static FuzzyMatch none(double bestSimilarity) {
        return new FuzzyMatch(null, bestSimilarity);
    }

    public boolean isMatched() {
        return match != null;
    }

    public Optional<String> matchOptional() {
        return Optional.ofNullable(match);
    }
}
