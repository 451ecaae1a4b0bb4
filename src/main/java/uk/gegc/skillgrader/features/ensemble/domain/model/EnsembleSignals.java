package uk.gegc.skillgrader.features.ensemble.domain.model;

import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;

/**
 * Inputs to one ensemble combination. A {@code null} score or similarity marks an unavailable signal.
 *
 * @param embeddingSimilarity submission-to-exemplar similarity in {@code [0, 1]}
 * @param referenceAdjustment signed points from the reference pool, applied to the combined score
 * @param integrity           may be {@code null} when integrity was not assessed
 * @param consistency         may be {@code null}
 */
public record EnsembleSignals(
        Integer judgmentScore,
        Integer validatorScore,
        Double embeddingSimilarity,
        boolean hasExemplar,
        int referenceAdjustment,
        IntegrityVerdict integrity,
        ConsistencyOverride consistency
) {
}
