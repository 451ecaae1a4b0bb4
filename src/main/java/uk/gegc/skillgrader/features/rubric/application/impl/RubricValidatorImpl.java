package uk.gegc.skillgrader.features.rubric.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.rubric.application.RubricValidator;
import uk.gegc.skillgrader.features.rubric.config.RubricProperties;
import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary;
import uk.gegc.skillgrader.features.rubric.domain.model.BreakdownSummary.CriterionPercentage;
import uk.gegc.skillgrader.features.rubric.domain.model.CorrectedScore;
import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;
import uk.gegc.skillgrader.features.rubric.domain.model.IssueSeverity;
import uk.gegc.skillgrader.features.rubric.domain.model.ReconciledCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricAggregation;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricIssue;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricIssueType;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationConfig;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationResult;
import uk.gegc.skillgrader.features.similarity.application.FuzzyTextMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class RubricValidatorImpl implements RubricValidator {

    static final String DEFAULTED_RATIONALE = "[Not scored by judge - defaulted to 0]";
    static final String CAPPED_SUFFIX = " [Points capped to max]";

    private final FuzzyTextMatcher fuzzyTextMatcher;
    private final RubricProperties rubricProperties;

    @Override
    public RubricValidationResult reconcileRubric(List<CriterionJudgment> breakdown,
                                                  List<RubricCriterion> rubric,
                                                  int claimedScore) {
        return reconcileRubric(breakdown, rubric, claimedScore, rubricProperties.toValidationConfig());
    }

    @Override
    public RubricValidationResult reconcileRubric(List<CriterionJudgment> breakdown,
                                                  List<RubricCriterion> rubric,
                                                  int claimedScore,
                                                  RubricValidationConfig config) {
        List<CriterionJudgment> judgments = breakdown == null ? List.of() : breakdown;
        List<RubricCriterion> criteria = rubric == null ? List.of() : rubric;

        List<RubricIssue> issues = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        // judgment index -> canonical criterion
        Map<Integer, RubricCriterion> assignment = matchLabels(judgments, criteria, config, notes);

        List<String> unmatchedLabels = new ArrayList<>();
        for (int i = 0; i < judgments.size(); i++) {
            if (!assignment.containsKey(i)) {
                String label = judgments.get(i).criterionLabel();
                unmatchedLabels.add(label);
                issues.add(new RubricIssue(
                        RubricIssueType.EXTRA_CRITERION,
                        IssueSeverity.WARNING,
                        label,
                        "Judge used criterion \"" + label + "\" which doesn't match any rubric criterion",
                        null,
                        null
                ));
            }
        }

        Map<String, Integer> judgmentByCriterion = new HashMap<>();
        assignment.forEach((index, criterion) -> judgmentByCriterion.put(criterion.name(), index));

        for (RubricCriterion criterion : criteria) {
            if (!judgmentByCriterion.containsKey(criterion.name())) {
                issues.add(new RubricIssue(
                        RubricIssueType.MISSING_CRITERION,
                        IssueSeverity.ERROR,
                        criterion.name(),
                        "Judge did not score criterion \"" + criterion.name() + "\"",
                        (double) criterion.maxPoints(),
                        null
                ));
            }
        }

        Map<String, ReconciledCriterion> reconciled = new LinkedHashMap<>();
        double totalAwarded = 0.0;
        int totalMax = 0;

        for (RubricCriterion criterion : criteria) {
            Integer index = judgmentByCriterion.get(criterion.name());
            int max = criterion.maxPoints();
            totalMax += max;

            if (index == null) {
                reconciled.put(criterion.name(), new ReconciledCriterion(0.0, max, DEFAULTED_RATIONALE, null));
                continue;
            }

            CriterionJudgment judgment = judgments.get(index);
            double points = judgment.pointsAwarded();
            String rationale = judgment.rationale() == null ? "" : judgment.rationale();

            if (Double.isNaN(points) || points < 0) {
                issues.add(new RubricIssue(
                        RubricIssueType.NEGATIVE_POINTS,
                        IssueSeverity.ERROR,
                        criterion.name(),
                        "Negative points (" + formatPoints(points) + ") for \"" + criterion.name() + "\"",
                        null,
                        points
                ));
                points = 0.0;
            } else if (points > max) {
                issues.add(new RubricIssue(
                        RubricIssueType.EXCEEDS_MAX,
                        IssueSeverity.ERROR,
                        criterion.name(),
                        "Points awarded (" + formatPoints(points) + ") exceeds max (" + max + ") for \"" + criterion.name() + "\"",
                        (double) max,
                        points
                ));
                if (config.autoCorrectExceedingPoints()) {
                    points = max;
                    rationale = rationale + CAPPED_SUFFIX;
                }
            }

            Double claimedMax = judgment.maxPointsClaimed();
            if (claimedMax != null && Double.compare(claimedMax, max) != 0) {
                issues.add(new RubricIssue(
                        RubricIssueType.INVALID_MAX,
                        IssueSeverity.WARNING,
                        criterion.name(),
                        "Judge used maxPoints=" + formatPoints(claimedMax) + " but rubric specifies " + max,
                        (double) max,
                        claimedMax
                ));
            }

            totalAwarded += points;
            reconciled.put(criterion.name(), new ReconciledCriterion(points, max, rationale, judgment.criterionLabel()));
        }

        int percentage = totalMax > 0 ? (int) Math.round(totalAwarded / totalMax * 100) : 0;
        int divergence = Math.abs(percentage - claimedScore);

        Integer correctedScore = null;
        if (divergence > config.maxScoreDivergence()) {
            issues.add(new RubricIssue(
                    RubricIssueType.SCORE_MISMATCH,
                    IssueSeverity.WARNING,
                    null,
                    "Rubric sum (" + formatPoints(totalAwarded) + "/" + totalMax + " = " + percentage
                            + "%) differs from claimed overall score (" + claimedScore + ") by " + divergence + " points",
                    (double) percentage,
                    (double) claimedScore
            ));
            if (config.autoCorrectScoreMismatch()) {
                correctedScore = percentage;
                notes.add("Auto-corrected overall score from " + claimedScore + " to " + percentage + " based on rubric sum");
            }
        }

        RubricAggregation aggregation = new RubricAggregation(
                totalAwarded,
                totalMax,
                percentage,
                criteria.size(),
                judgmentByCriterion.size(),
                List.copyOf(unmatchedLabels)
        );

        boolean valid = issues.stream().noneMatch(RubricIssue::isError);

        log.debug("Rubric reconciled: matched={}/{}, percentage={}, claimed={}, issues={}",
                aggregation.matchedCount(), aggregation.criteriaCount(), percentage, claimedScore, issues.size());

        return new RubricValidationResult(
                valid,
                List.copyOf(issues),
                List.copyOf(notes),
                reconciled,
                correctedScore,
                aggregation
        );
    }

    /**
     * Exact case-insensitive matches are claimed first. The remaining labels and criteria are then paired
     * greedily by descending fuzzy similarity, each criterion claimed at most once.
     */
    private Map<Integer, RubricCriterion> matchLabels(List<CriterionJudgment> judgments,
                                                      List<RubricCriterion> criteria,
                                                      RubricValidationConfig config,
                                                      List<String> notes) {
        Map<Integer, RubricCriterion> assignment = new LinkedHashMap<>();
        List<RubricCriterion> remaining = new ArrayList<>(criteria);

        for (int i = 0; i < judgments.size(); i++) {
            String label = normalize(judgments.get(i).criterionLabel());
            for (RubricCriterion criterion : remaining) {
                if (normalize(criterion.name()).equals(label)) {
                    assignment.put(i, criterion);
                    remaining.remove(criterion);
                    break;
                }
            }
        }

        if (!config.fuzzyMatchingEnabled() || remaining.isEmpty()) {
            return assignment;
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < judgments.size(); i++) {
            if (assignment.containsKey(i)) {
                continue;
            }
            String label = judgments.get(i).criterionLabel();
            for (int c = 0; c < remaining.size(); c++) {
                double similarity = fuzzyTextMatcher.effectiveSimilarity(label, remaining.get(c).name());
                if (similarity >= config.fuzzyMatchThreshold()) {
                    candidates.add(new Candidate(i, c, similarity));
                }
            }
        }
        // stable sort keeps label order, then rubric order, on ties
        candidates.sort(Comparator.comparingDouble(Candidate::similarity).reversed());

        boolean[] claimed = new boolean[remaining.size()];
        for (Candidate candidate : candidates) {
            if (assignment.containsKey(candidate.judgmentIndex()) || claimed[candidate.criterionIndex()]) {
                continue;
            }
            RubricCriterion criterion = remaining.get(candidate.criterionIndex());
            claimed[candidate.criterionIndex()] = true;
            assignment.put(candidate.judgmentIndex(), criterion);
            notes.add("Fuzzy matched \"" + judgments.get(candidate.judgmentIndex()).criterionLabel() + "\" -> \""
                    + criterion.name() + "\" (" + Math.round(candidate.similarity() * 100) + "% similarity)");
        }
        return assignment;
    }

    @Override
    public CorrectedScore calculateCorrectedScore(int claimedScore, RubricValidationResult result) {
        return calculateCorrectedScore(
                claimedScore,
                result,
                rubricProperties.getBlendWeight(),
                rubricProperties.getBlendDivergenceThreshold()
        );
    }

    @Override
    public CorrectedScore calculateCorrectedScore(int claimedScore,
                                                  RubricValidationResult result,
                                                  double rubricWeight,
                                                  int divergenceThreshold) {
        int rubricScore = result.aggregation().percentage();
        int divergence = Math.abs(rubricScore - claimedScore);

        if (divergence <= divergenceThreshold) {
            return new CorrectedScore(claimedScore, false, 0);
        }

        long blended = Math.round(claimedScore * (1 - rubricWeight) + rubricScore * rubricWeight);
        int score = (int) Math.max(0, Math.min(100, blended));
        return new CorrectedScore(score, true, score - claimedScore);
    }

    @Override
    public BreakdownSummary summarizeBreakdown(Map<String, ReconciledCriterion> breakdown) {
        if (breakdown == null || breakdown.isEmpty()) {
            return new BreakdownSummary(List.of(), null, null, 0);
        }

        List<CriterionPercentage> percentages = breakdown.entrySet().stream()
                .map(entry -> {
                    ReconciledCriterion value = entry.getValue();
                    int percentage = value.maxPoints() > 0
                            ? (int) Math.round(value.pointsAwarded() / value.maxPoints() * 100)
                            : 0;
                    return new CriterionPercentage(entry.getKey(), value.pointsAwarded(), value.maxPoints(), percentage);
                })
                .toList();

        List<CriterionPercentage> sorted = percentages.stream()
                .sorted(Comparator.comparingInt(CriterionPercentage::percentage))
                .toList();

        int average = (int) Math.round(percentages.stream()
                .mapToInt(CriterionPercentage::percentage)
                .average()
                .orElse(0));

        return new BreakdownSummary(percentages, sorted.get(0), sorted.get(sorted.size() - 1), average);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private static String formatPoints(double points) {
        return points == Math.rint(points) ? String.valueOf((long) points) : String.valueOf(points);
    }

    private record Candidate(int judgmentIndex, int criterionIndex, double similarity) {
    }
}
