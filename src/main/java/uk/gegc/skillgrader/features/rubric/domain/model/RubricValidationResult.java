package uk.gegc.skillgrader.features.rubric.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Result of reconciling a judge breakdown against the canonical rubric.
 * <p>
 * {@code reconciledBreakdown} is keyed by canonical criterion name in rubric order and covers every
 * criterion exactly once. {@code correctedScore} is only present when score mismatch correction is
 * enabled and triggered.
 * </p>
 */
public record RubricValidationResult(
        @JsonProperty("isValid")
        boolean valid,
        List<RubricIssue> issues,
        List<String> notes,
        Map<String, ReconciledCriterion> reconciledBreakdown,
        Integer correctedScore,
        RubricAggregation aggregation
) {

    public long errorCount() {
        return issues.stream().filter(RubricIssue::isError).count();
    }

    public List<RubricIssue> issuesOfType(RubricIssueType type) {
        return issues.stream().filter(issue -> issue.type() == type).toList();
    }
}
