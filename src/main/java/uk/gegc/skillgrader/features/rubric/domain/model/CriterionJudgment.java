package uk.gegc.skillgrader.features.rubric.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "CriterionJudgment", description = "One criterion as scored by the judge, label still free-form")
public record CriterionJudgment(
        @Schema(description = "Label as emitted by the judge", example = "Clarity of the response")
        @NotBlank
        String criterionLabel,

        @Schema(description = "Points the judge awarded", example = "20")
        double pointsAwarded,

        @Schema(description = "Max points the judge believed the criterion carries", example = "25")
        Double maxPointsClaimed,

        @Schema(description = "Judge rationale")
        String rationale
) {
}
