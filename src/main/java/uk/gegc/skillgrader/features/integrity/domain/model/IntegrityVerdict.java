package uk.gegc.skillgrader.features.integrity.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IntegrityVerdict(
        RiskLevel riskLevel,
        @JsonProperty("isLikelyOriginal") boolean likelyOriginal,
        List<String> flags,
        IntegritySignals signals
) {

    public boolean isExactCopy() {
        return signals.exactCopy();
    }
}
