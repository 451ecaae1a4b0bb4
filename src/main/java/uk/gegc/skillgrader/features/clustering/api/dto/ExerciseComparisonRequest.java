package uk.gegc.skillgrader.features.clustering.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ExerciseComparisonRequest", description = "Pair of exercises to compare")
public record ExerciseComparisonRequest(
        @Schema(example = "boolean-search-basics")
        @NotBlank(message = "First exercise id must not be blank")
        String exerciseIdA,

        @Schema(example = "boolean-search-advanced")
        @NotBlank(message = "Second exercise id must not be blank")
        String exerciseIdB
) {
}
