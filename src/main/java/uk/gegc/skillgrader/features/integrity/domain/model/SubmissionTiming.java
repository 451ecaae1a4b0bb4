package uk.gegc.skillgrader.features.integrity.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Optional timing metadata. The speed rule only runs when both values are present.
 */
@Schema(name = "SubmissionTiming", description = "How long the learner spent versus the expected minimum")
public record SubmissionTiming(
        @Schema(description = "Time spent on the submission in milliseconds", example = "45000")
        @PositiveOrZero
        Long submissionTimeMs,

        @Schema(description = "Minimum expected time in milliseconds", example = "300000")
        @PositiveOrZero
        Long minExpectedTimeMs
) {

    public boolean isComplete() {
        return submissionTimeMs != null && minExpectedTimeMs != null && submissionTimeMs > 0 && minExpectedTimeMs > 0;
    }
}
