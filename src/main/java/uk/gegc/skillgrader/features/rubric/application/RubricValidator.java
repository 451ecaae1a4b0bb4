package uk.gegc.skillgrader.features.rubric.application;

import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;
import uk.gegc.skillgrader.features.rubric.domain.model.ReconciledCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationConfig;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Reconciles a judge's per-criterion breakdown against an exercise rubric.
 * <p>
 * Violations are reported as issues on the result; nothing here throws for a malformed breakdown.
 * </p>
 */
public interface RubricValidator {

    RubricValidationResult reconcileRubric(List<CriterionJudgment> breakdown,
                                           List<RubricCriterion> rubric,
                                           int claimedScore,
                                           RubricValidationConfig config);

    /**
     * Reconciles with the configured defaults.
     */
    RubricValidationResult reconcileRubric(List<CriterionJudgment> breakdown,
                                           List<RubricCriterion> rubric,
                                           int claimedScore);

    /**
     * Blends the claimed score with the rubric percentage when they diverge by more than {@code divergenceThreshold}.
     */
    CorrectedScore calculateCorrectedScore(int claimedScore,
                                           RubricValidationResult result,
                                           double rubricWeight,
                                           int divergenceThreshold);

    CorrectedScore calculateCorrectedScore(int claimedScore, RubricValidationResult result);

    BreakdownSummary summarizeBreakdown(Map<String, ReconciledCriterion> breakdown);
}
