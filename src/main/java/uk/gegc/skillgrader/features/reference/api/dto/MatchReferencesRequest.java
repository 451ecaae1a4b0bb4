package uk.gegc.skillgrader.features.reference.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;

@Schema(name = "MatchReferencesRequest", description = "Text or embedding to compare against the reference bank")
public record MatchReferencesRequest(
        @Schema(description = "Exercise whose pool is queried", example = "boolean-search-basics")
        @NotBlank(message = "Exercise id must not be blank")
        String exerciseId,

        @Schema(description = "Text to embed; ignored when an embedding is supplied")
        String text,

        @Schema(description = "Precomputed embedding")
        float[] embedding,

        @Schema(description = "Matching settings; configured defaults when omitted")
        ReferenceMatchConfig config
) {
}
