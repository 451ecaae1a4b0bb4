package uk.gegc.skillgrader.features.reference.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceSourceKind;

@Schema(name = "ReferenceAnswerRequest", description = "Answer proposed for an exercise's reference bank")
public record ReferenceAnswerRequest(
        @Schema(description = "Exercise the answer belongs to", example = "boolean-search-basics")
        @NotBlank(message = "Exercise id must not be blank")
        String exerciseId,

        @Schema(description = "Answer text")
        @NotBlank(message = "Submission text must not be blank")
        @Size(max = 20000, message = "Submission text must not exceed 20000 characters")
        String submissionText,

        @Schema(description = "Score the answer received", example = "91")
        @Min(value = 0, message = "Score must be between 0 and 100")
        @Max(value = 100, message = "Score must be between 0 and 100")
        int score,

        @Schema(description = "Precomputed embedding; the text is embedded when omitted")
        float[] embedding,

        @Schema(description = "Origin of the answer; learner when omitted", example = "learner")
        ReferenceSourceKind sourceKind,

        @Min(0) @Max(100)
        Integer judgmentScore,

        @Min(0) @Max(100)
        Integer validatorScore,

        @DecimalMin("0.0") @DecimalMax("1.0")
        Double embeddingSimilarity
) {
}
