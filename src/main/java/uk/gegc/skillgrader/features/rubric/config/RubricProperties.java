package uk.gegc.skillgrader.features.rubric.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.skillgrader.features.rubric.domain.model.RubricValidationConfig;

/**
 * Rubric reconciliation defaults.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "skillgrader.rubric")
public class RubricProperties {

    private boolean fuzzyMatchingEnabled = true;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double fuzzyMatchThreshold = 0.7;

    /**
     * Points of divergence between claimed and rubric-derived score that raise score_mismatch.
     */
    @PositiveOrZero
    private int maxScoreDivergence = 5;

    private boolean autoCorrectExceedingPoints = true;

    /**
     * Overwrite the claimed score with the rubric percentage on mismatch. Off: mismatches are only surfaced.
     */
    private boolean autoCorrectScoreMismatch = false;

    /**
     * Share of the rubric percentage in the corrected-score blend.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double blendWeight = 0.3;

    /**
     * Divergence above which the blend is applied. Larger than maxScoreDivergence so noise is flagged, not corrected.
     */
    @PositiveOrZero
    private int blendDivergenceThreshold = 10;

    public RubricValidationConfig toValidationConfig() {
        return new RubricValidationConfig(
                fuzzyMatchingEnabled,
                fuzzyMatchThreshold,
                maxScoreDivergence,
                autoCorrectExceedingPoints,
                autoCorrectScoreMismatch
        );
    }
}
