package uk.gegc.skillgrader.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricCriterion;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationConfig;

import java.util.List;

@Schema(name = "ReconcileRubricRequest", description = "Judge breakdown to reconcile against a rubric")
public record ReconcileRubricRequest(
        @Schema(description = "Per-criterion judgments as produced by the judge")
        @NotNull(message = "Breakdown must not be null")
        List<CriterionJudgment> breakdown,

        @Schema(description = "Canonical rubric")
        @NotEmpty(message = "Rubric must contain at least one criterion")
        List<@Valid RubricCriterion> rubric,

        @Schema(description = "Overall score claimed by the judge", example = "82")
        @Min(value = 0, message = "Claimed score must be between 0 and 100")
        @Max(value = 100, message = "Claimed score must be between 0 and 100")
        int claimedScore,

        @Schema(description = "Reconciliation settings; configured defaults when omitted")
        RubricValidationConfig config
) {
}
