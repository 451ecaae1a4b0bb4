package uk.gegc.skillgrader.features.clustering.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import uk.gegc.skillgrader.features.clustering.domain.model.ClusterProgress;

@Schema(name = "ClusterInsightsRequest", description = "Score just achieved on an exercise, with optional progress snapshot")
public record ClusterInsightsRequest(
        @Schema(example = "boolean-search-basics")
        @NotBlank(message = "Exercise id must not be blank")
        String exerciseId,

        @Schema(example = "88")
        @Min(value = 0, message = "Score must be between 0 and 100")
        @Max(value = 100, message = "Score must be between 0 and 100")
        int currentScore,

        @Schema(description = "Learner whose stored progress is used when no snapshot is supplied")
        String learnerId,

        @Schema(description = "Progress snapshot for the exercise's skill cluster")
        ClusterProgress progress
) {
}
