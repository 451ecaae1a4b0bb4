package uk.gegc.skillgrader.features.rubric.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@Schema(name = "RubricCriterion", description = "Canonical rubric criterion of an exercise")
public record RubricCriterion(
        @Schema(description = "Canonical criterion name", example = "Clarity")
        @NotBlank
        String name,

        @Schema(description = "Maximum points for the criterion", example = "25")
        @Positive
        int maxPoints,

        @Schema(description = "What the criterion rewards")
        String description
) {
}
