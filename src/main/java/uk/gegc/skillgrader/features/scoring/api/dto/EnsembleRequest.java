package uk.gegc.skillgrader.features.scoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import uk.gegc.skillgrader.features.ensemble.domain.model.ConsistencyOverride;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleSignals;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleWeights;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;

@Schema(name = "EnsembleRequest", description = "Signals to combine; omitted scores are treated as unavailable")
public record EnsembleRequest(
        @Schema(example = "84")
        @Min(0) @Max(100)
        Integer judgmentScore,

        @Schema(example = "78")
        @Min(0) @Max(100)
        Integer validatorScore,

        @Schema(description = "Submission-to-exemplar similarity", example = "0.81")
        @DecimalMin("0.0") @DecimalMax("1.0")
        Double embeddingSimilarity,

        boolean hasExemplar,

        @Schema(description = "Signed points from the reference pool", example = "2")
        @Min(-100) @Max(100)
        int referenceAdjustment,

        @Schema(description = "Integrity verdict as returned by the integrity endpoint")
        IntegrityVerdict integrity,

        ConsistencyOverride consistency,

        @Schema(description = "Component weights; configured defaults when omitted")
        EnsembleWeights weights
) {

    public EnsembleSignals toSignals() {
        return new EnsembleSignals(judgmentScore, validatorScore, embeddingSimilarity, hasExemplar,
                referenceAdjustment, integrity, consistency);
    }
}
