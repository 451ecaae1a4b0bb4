package uk.gegc.skillgrader.features.ensemble.application;

import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleResult;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleSignals;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleWeights;

/**
 * Combines the judgment, validator and embedding signals into one bounded score.
 * <p>
 * Confidence is driven by how much the active signals disagree, not by which of them is right.
 * Integrity penalties and the perfect-score rule are applied after the weighted combination.
 * </p>
 */
public interface EnsembleScorer {

    EnsembleResult combineEnsemble(EnsembleSignals signals, EnsembleWeights weights);

    /**
     * Combines with the configured weights.
     */
    EnsembleResult combineEnsemble(EnsembleSignals signals);
}
