package uk.gegc.skillgrader.features.ensemble.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleWeights;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "skillgrader.ensemble")
public class EnsembleProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double judgmentWeight = 0.55;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double validatorWeight = 0.30;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double embeddingWeight = 0.15;

    public EnsembleWeights toWeights() {
        return new EnsembleWeights(judgmentWeight, validatorWeight, embeddingWeight);
    }
}
