package uk.gegc.skillgrader.features.ensemble.domain.model;

import java.util.List;

/**
 * Combined score with its uncertainty.
 *
 * @param preAdjustmentScore weighted combination before reference and integrity adjustments
 * @param adjustments        human-readable log of every adjustment applied, in order
 */
public record EnsembleResult(
        int finalScore,
        int preAdjustmentScore,
        int confidence,
        ConfidenceBand confidenceBand,
        ScoreRange range,
        ComponentWeights componentWeights,
        int agreement,
        List<String> adjustments
) {
}
