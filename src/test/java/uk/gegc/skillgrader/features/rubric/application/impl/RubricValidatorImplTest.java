package uk.gegc.skillgrader.features.rubric.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.skillgrader.BaseUnitTest;
import uk.gegc.skillgrader.features.rubric.config.RubricProperties;
import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;
import uk.gegc.skillgrader.features.rubric.domain.model.IssueSeverity;
import uk.gegc.skillgrader.features.rubric.domain.model.ReconciledCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricIssue;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricIssueType;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationConfig;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;
import uk.gegc.skillgrader.features.similarity.application.FuzzyTextMatcher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RubricValidatorImpl")
class RubricValidatorImplTest extends BaseUnitTest {

    private static final List<RubricCriterion> RUBRIC = List.of(
            new RubricCriterion("Clarity", 25, "Clear and readable"),
            new RubricCriterion("Completeness", 25, "Covers every requirement"),
            new RubricCriterion("Accuracy", 50, "Factually correct")
    );

    private RubricValidatorImpl validator;

    @BeforeEach
    void setUp() {
        validator = new RubricValidatorImpl(new FuzzyTextMatcher(), new RubricProperties());
    }

    private static CriterionJudgment judged(String label, double points) {
        return new CriterionJudgment(label, points, null, "because");
    }

    @Nested
    @DisplayName("reconcileRubric")
    class Reconcile {

        @Test
        @DisplayName("typo is fuzzy matched and over-max points are capped to a 95/100 total")
        void typoAndOverMax() {
            List<CriterionJudgment> breakdown = List.of(
                    judged("clarity", 25),
                    judged("Completness", 20),
                    judged("Accuracy", 60)
            );

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 95);

            assertEquals(95.0, result.aggregation().totalAwarded());
            assertEquals(100, result.aggregation().totalMax());
            assertEquals(95, result.aggregation().percentage());
            assertEquals(3, result.aggregation().matchedCount());
            assertThat(result.aggregation().unmatchedLabels()).isEmpty();

            ReconciledCriterion completeness = result.reconciledBreakdown().get("Completeness");
            assertEquals(20.0, completeness.pointsAwarded());
            assertEquals("Completness", completeness.matchedLabel());

            ReconciledCriterion accuracy = result.reconciledBreakdown().get("Accuracy");
            assertEquals(50.0, accuracy.pointsAwarded());
            assertThat(accuracy.rationale()).endsWith(RubricValidatorImpl.CAPPED_SUFFIX);

            List<RubricIssue> exceeds = result.issuesOfType(RubricIssueType.EXCEEDS_MAX);
            assertEquals(1, exceeds.size());
            assertEquals(IssueSeverity.ERROR, exceeds.get(0).severity());
            assertEquals("Accuracy", exceeds.get(0).criterion());
            assertFalse(result.valid());
            assertThat(result.notes()).contains("Fuzzy matched \"Completness\" -> \"Completeness\" (92% similarity)");
        }

        @Test
        @DisplayName("unscored criterion defaults to zero with a missing_criterion error")
        void missingCriterion() {
            List<CriterionJudgment> breakdown = List.of(judged("Clarity", 20), judged("Accuracy", 40));

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 60);

            ReconciledCriterion completeness = result.reconciledBreakdown().get("Completeness");
            assertEquals(0.0, completeness.pointsAwarded());
            assertTrue(completeness.defaulted());
            assertEquals(RubricValidatorImpl.DEFAULTED_RATIONALE, completeness.rationale());

            List<RubricIssue> missing = result.issuesOfType(RubricIssueType.MISSING_CRITERION);
            assertEquals(1, missing.size());
            assertEquals("Judge did not score criterion \"Completeness\"", missing.get(0).message());
            assertEquals(25.0, missing.get(0).expected());
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("unmatched judge label is a warning and never enters the breakdown")
        void extraCriterion() {
            List<CriterionJudgment> breakdown = List.of(
                    judged("Clarity", 20),
                    judged("Completeness", 20),
                    judged("Accuracy", 40),
                    judged("Tone", 5)
            );

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 80);

            List<RubricIssue> extra = result.issuesOfType(RubricIssueType.EXTRA_CRITERION);
            assertEquals(1, extra.size());
            assertEquals(IssueSeverity.WARNING, extra.get(0).severity());
            assertEquals(List.of("Tone"), result.aggregation().unmatchedLabels());
            assertThat(result.reconciledBreakdown()).containsOnlyKeys("Clarity", "Completeness", "Accuracy");
            assertEquals(80, result.aggregation().percentage());
            assertTrue(result.valid());
        }

        @Test
        @DisplayName("negative points are floored at zero with an error")
        void negativePoints() {
            List<CriterionJudgment> breakdown = List.of(
                    judged("Clarity", -5),
                    judged("Completeness", 25),
                    judged("Accuracy", 50)
            );

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 75);

            assertEquals(0.0, result.reconciledBreakdown().get("Clarity").pointsAwarded());
            assertEquals(1, result.issuesOfType(RubricIssueType.NEGATIVE_POINTS).size());
            assertEquals(75, result.aggregation().percentage());
        }

        @Test
        @DisplayName("a judge max differing from the rubric is a warning only")
        void invalidMaxIsWarning() {
            List<CriterionJudgment> breakdown = List.of(
                    new CriterionJudgment("Clarity", 20, 20.0, "ok"),
                    judged("Completeness", 20),
                    judged("Accuracy", 40)
            );

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 80);

            List<RubricIssue> invalidMax = result.issuesOfType(RubricIssueType.INVALID_MAX);
            assertEquals(1, invalidMax.size());
            assertEquals("Judge used maxPoints=20 but rubric specifies 25", invalidMax.get(0).message());
            assertTrue(result.valid());
        }

        @Test
        @DisplayName("score mismatch is surfaced but not corrected by default")
        void scoreMismatchSurfacedOnly() {
            List<CriterionJudgment> breakdown = List.of(
                    judged("Clarity", 10),
                    judged("Completeness", 10),
                    judged("Accuracy", 20)
            );

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 90);

            assertEquals(1, result.issuesOfType(RubricIssueType.SCORE_MISMATCH).size());
            assertNull(result.correctedScore());
            assertTrue(result.valid());
        }

        @Test
        @DisplayName("score mismatch is corrected when auto-correction is enabled")
        void scoreMismatchCorrectedWhenEnabled() {
            List<CriterionJudgment> breakdown = List.of(
                    judged("Clarity", 10),
                    judged("Completeness", 10),
                    judged("Accuracy", 20)
            );
            RubricValidationConfig config = new RubricValidationConfig(true, 0.7, 5, true, true);

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 90, config);

            assertEquals(40, result.correctedScore());
            assertThat(result.notes()).contains("Auto-corrected overall score from 90 to 40 based on rubric sum");
        }

        @Test
        @DisplayName("with fuzzy matching disabled a typo leaves the criterion unscored")
        void fuzzyDisabled() {
            List<CriterionJudgment> breakdown = List.of(
                    judged("Clarity", 25),
                    judged("Completness", 20),
                    judged("Accuracy", 50)
            );
            RubricValidationConfig config = new RubricValidationConfig(false, 0.7, 5, true, false);

            RubricValidationResult result = validator.reconcileRubric(breakdown, RUBRIC, 95, config);

            assertEquals(List.of("Completness"), result.aggregation().unmatchedLabels());
            assertEquals(1, result.issuesOfType(RubricIssueType.MISSING_CRITERION).size());
            assertEquals(75, result.aggregation().percentage());
        }

        @Test
        @DisplayName("each criterion is claimed by at most one label")
        void oneToOneMatching() {
            List<RubricCriterion> rubric = List.of(new RubricCriterion("Clarity", 50, null),
                    new RubricCriterion("Structure", 50, null));
            List<CriterionJudgment> breakdown = List.of(
                    judged("Clarity of the response", 30),
                    judged("Clarity", 40)
            );

            RubricValidationResult result = validator.reconcileRubric(breakdown, rubric, 40);

            assertEquals(40.0, result.reconciledBreakdown().get("Clarity").pointsAwarded());
            assertEquals("Clarity", result.reconciledBreakdown().get("Clarity").matchedLabel());
            assertEquals(List.of("Clarity of the response"), result.aggregation().unmatchedLabels());
        }
    }

    @Nested
    @DisplayName("calculateCorrectedScore")
    class Correction {

        private RubricValidationResult resultWithPercentage(int claimed, double clarity, double completeness, double accuracy) {
            return validator.reconcileRubric(List.of(
                    judged("Clarity", clarity),
                    judged("Completeness", completeness),
                    judged("Accuracy", accuracy)
            ), RUBRIC, claimed);
        }

        @Test
        @DisplayName("small divergence keeps the claimed score")
        void withinThreshold() {
            RubricValidationResult result = resultWithPercentage(90, 25, 20, 40);

            CorrectedScore corrected = validator.calculateCorrectedScore(90, result);

            assertEquals(new CorrectedScore(90, false, 0), corrected);
        }

        @Test
        @DisplayName("large divergence blends towards the rubric percentage")
        void blendsBeyondThreshold() {
            RubricValidationResult result = resultWithPercentage(90, 15, 15, 30);

            CorrectedScore corrected = validator.calculateCorrectedScore(90, result);

            // 90 * 0.7 + 60 * 0.3
            assertEquals(81, corrected.score());
            assertTrue(corrected.wasAdjusted());
            assertEquals(-9, corrected.adjustment());
        }

        @Test
        @DisplayName("explicit weight and threshold override configuration")
        void explicitParameters() {
            RubricValidationResult result = resultWithPercentage(90, 15, 15, 30);

            CorrectedScore corrected = validator.calculateCorrectedScore(90, result, 0.5, 40);

            assertEquals(new CorrectedScore(90, false, 0), corrected);
            assertEquals(75, validator.calculateCorrectedScore(90, result, 0.5, 10).score());
        }
    }

    @Nested
    @DisplayName("summarizeBreakdown")
    class Summary {

        @Test
        @DisplayName("reports per-criterion percentages with lowest and highest")
        void summarizes() {
            Map<String, ReconciledCriterion> breakdown = new LinkedHashMap<>();
            breakdown.put("Clarity", new ReconciledCriterion(25, 25, "", "Clarity"));
            breakdown.put("Completeness", new ReconciledCriterion(10, 25, "", "Completeness"));
            breakdown.put("Accuracy", new ReconciledCriterion(35, 50, "", "Accuracy"));

            BreakdownSummary summary = validator.summarizeBreakdown(breakdown);

            assertEquals(3, summary.criteria().size());
            assertEquals("Completeness", summary.lowest().name());
            assertEquals(40, summary.lowest().percentage());
            assertEquals("Clarity", summary.highest().name());
            assertEquals(100, summary.highest().percentage());
            // (100 + 40 + 70) / 3
            assertEquals(70, summary.averagePercentage());
        }

        @Test
        @DisplayName("empty breakdown has no extremes")
        void empty() {
            BreakdownSummary summary = validator.summarizeBreakdown(Map.of());

            assertThat(summary.criteria()).isEmpty();
            assertNull(summary.lowest());
            assertEquals(0, summary.averagePercentage());
        }
    }
}
