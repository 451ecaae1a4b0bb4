package uk.gegc.skillgrader.features.ensemble.domain.model;

public record EnsembleWeights(double judgment, double validator, double embedding) {

    public static EnsembleWeights defaults() {
        return new EnsembleWeights(0.55, 0.30, 0.15);
    }
}
