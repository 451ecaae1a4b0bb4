package uk.gegc.skillgrader.features.clustering.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * @param metrics may be {@code null}
 */
public record ClusterInsight(
        InsightType type,
        String title,
        String message,
        List<String> relatedExerciseIds,
        @JsonInclude(JsonInclude.Include.NON_NULL) InsightMetrics metrics
) {
}
