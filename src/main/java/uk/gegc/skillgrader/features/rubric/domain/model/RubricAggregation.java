package uk.gegc.skillgrader.features.rubric.domain.model;

import java.util.List;

public record RubricAggregation(
        double totalAwarded,
        int totalMax,
        int percentage,
        int criteriaCount,
        int matchedCount,
        List<String> unmatchedLabels
) {
}
