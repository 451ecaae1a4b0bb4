package uk.gegc.skillgrader.features.integrity.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw counters behind an integrity verdict.
 *
 * @param exemplarCopyScore embedding similarity to the exemplar on a 0-100 scale
 */
public record IntegritySignals(
        int exemplarCopyScore,
        @JsonProperty("isExactCopy") boolean exactCopy,
        @JsonProperty("isTooShort") boolean tooShort,
        @JsonProperty("isTooFast") boolean tooFast,
        @JsonProperty("hasRepetitivePatterns") boolean repetitivePatterns,
        @JsonProperty("hasPlaceholders") boolean placeholders,
        int lowEffortIndicators
) {
}
