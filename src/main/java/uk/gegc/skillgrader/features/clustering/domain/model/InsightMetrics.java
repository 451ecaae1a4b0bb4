package uk.gegc.skillgrader.features.clustering.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsightMetrics(
        Integer previousScore,
        Integer currentScore,
        Double improvementPercent,
        Double clusterAverage
) {
}
