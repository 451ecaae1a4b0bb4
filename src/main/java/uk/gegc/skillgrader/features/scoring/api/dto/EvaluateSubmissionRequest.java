package uk.gegc.skillgrader.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import uk.gegc.skillgrader.features.ensemble.domain.model.ConsistencyOverride;

@Schema(name = "EvaluateSubmissionRequest", description = "Submission and raw judge output to score")
public record EvaluateSubmissionRequest(
        @Schema(description = "Exercise the submission answers", example = "boolean-search-basics")
        @NotBlank(message = "Exercise id must not be blank")
        String exerciseId,

        @Schema(description = "Learner identifier, used for progress insights", example = "learner-42")
        String learnerId,

        @Schema(description = "Submission text")
        @NotBlank(message = "Submission must not be blank")
        @Size(max = 20000, message = "Submission must not exceed 20000 characters")
        String submission,

        @Schema(description = "Raw judge response, JSON optionally wrapped in markdown fences")
        @NotBlank(message = "Judgment must not be blank")
        String rawJudgment,

        @Schema(description = "Rule-based validator score, omitted when the validator did not run", example = "78")
        @Min(value = 0, message = "Validator score must be between 0 and 100")
        @Max(value = 100, message = "Validator score must be between 0 and 100")
        Integer validatorScore,

        @Schema(description = "Time the learner spent before submitting, in milliseconds", example = "240000")
        @PositiveOrZero(message = "Submission time must not be negative")
        Long submissionTimeMs,

        @Schema(description = "Optional output of a consistency check on the judgment")
        ConsistencyOverride consistency
) {
}
