package uk.gegc.skillgrader.features.scoring.application;

import uk.gegc.skillgrader.features.integrity.domain.model.RiskLevel;

/**
 * Counters for scoring and reference bank activity.
 */
public interface ScoringMetricsService {

    void recordEvaluation(RiskLevel riskLevel, boolean judgmentMalformed);

    void recordReferenceInsert(boolean added);

    void recordCrossExerciseFallback();

    void recordReferenceLookupFailure();
}
