package uk.gegc.skillgrader.features.rubric.domain.model;

import java.util.List;

public record BreakdownSummary(
        List<CriterionPercentage> criteria,
        CriterionPercentage lowest,
        CriterionPercentage highest,
        int averagePercentage
) {

    public record CriterionPercentage(String name, double pointsAwarded, int maxPoints, int percentage) {
    }
}
