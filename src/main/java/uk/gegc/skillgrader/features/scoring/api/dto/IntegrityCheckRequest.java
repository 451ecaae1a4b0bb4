package uk.gegc.skillgrader.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import uk.gegc.skillgrader.features.integrity.domain.model.SubmissionTiming;

@Schema(name = "IntegrityCheckRequest", description = "Submission to check for copying and low effort")
public record IntegrityCheckRequest(
        @Schema(description = "Submission text")
        @NotNull(message = "Submission must not be null")
        String submission,

        @Schema(description = "Exemplar answer; copy checks are skipped without it")
        String exemplar,

        @Schema(description = "Submission-to-exemplar embedding similarity", example = "0.42")
        @DecimalMin(value = "0.0", message = "Similarity must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Similarity must be between 0 and 1")
        double embeddingSimilarity,

        @Schema(description = "Optional timing metadata")
        @Valid
        SubmissionTiming timing
) {
}
