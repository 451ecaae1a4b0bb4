package uk.gegc.skillgrader.features.scoring.domain.model;

import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleResult;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.reference.domain.model.ReferencePoolResult;
import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;

import java.time.Instant;

/**
 * Everything produced while scoring one submission.
 *
 * @param judgmentScore       judgment score fed to the ensemble after rubric correction, {@code null} when dropped
 * @param rubric              {@code null} when the judgment carried no score or the exercise has no rubric
 * @param rubricCorrection    {@code null} when {@code rubric} is
 * @param embeddingSimilarity submission-to-exemplar similarity, {@code null} without exemplar or embeddings
 */
public record SubmissionEvaluation(
        String exerciseId,
        int finalScore,
        ParsedJudgment judgment,
        Integer judgmentScore,
        Integer validatorScore,
        RubricValidationResult rubric,
        CorrectedScore rubricCorrection,
        BreakdownSummary breakdownSummary,
        IntegrityVerdict integrity,
        Double embeddingSimilarity,
        ReferencePoolResult referencePool,
        int referenceAdjustment,
        EnsembleResult ensemble,
        Instant evaluatedAt
) {
}
