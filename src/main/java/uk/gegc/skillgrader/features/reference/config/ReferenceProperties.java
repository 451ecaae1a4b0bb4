package uk.gegc.skillgrader.features.reference.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;

/**
 * Reference bank thresholds and pool weighting.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "skillgrader.reference")
public class ReferenceProperties {

    /**
     * Minimum score (0-100) for a submission to enter, or be read from, the reference bank.
     */
    @Min(0)
    @Max(100)
    private int qualityThreshold = 80;

    @Positive
    private int topK = 10;

    /**
     * Similarity at or above which a reference counts as a good match.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double matchThreshold = 0.70;

    /**
     * Near-duplicate similarity; candidates above it are rejected.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double duplicateThreshold = 0.95;

    private CrossExercise crossExercise = new CrossExercise();

    private Weight weight = new Weight();

    @Data
    public static class CrossExercise {

        private boolean enabled = true;

        /**
         * Direct pool size below which the cross-exercise pool is consulted.
         */
        @Min(0)
        private int fallbackMinimum = 3;

        private double similarityPenalty = 0.10;

        private double sameDifficultyBonus = 0.05;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minSimilarity = 0.60;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double weightMultiplier = 0.7;

        @Positive
        private int maxCandidates = 15;
    }

    @Data
    public static class Weight {

        private double base = 0.10;

        private double perVerified = 0.01;

        private double maxVerifiedBonus = 0.05;

        private double cap = 0.20;
    }

    public ReferenceMatchConfig toMatchConfig() {
        return new ReferenceMatchConfig(
                qualityThreshold,
                topK,
                matchThreshold,
                crossExercise.isEnabled(),
                crossExercise.getFallbackMinimum(),
                crossExercise.getSimilarityPenalty(),
                crossExercise.getSameDifficultyBonus(),
                crossExercise.getMinSimilarity(),
                crossExercise.getWeightMultiplier(),
                crossExercise.getMaxCandidates()
        );
    }
}
