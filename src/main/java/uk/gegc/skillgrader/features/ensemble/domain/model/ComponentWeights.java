package uk.gegc.skillgrader.features.ensemble.domain.model;

/**
 * Effective weights after dropping unavailable signals and renormalizing. They sum to 1 unless no
 * signal was available, in which case all are zero.
 */
public record ComponentWeights(double judgment, double validator, double embedding) {

    public static ComponentWeights none() {
        return new ComponentWeights(0.0, 0.0, 0.0);
    }
}
