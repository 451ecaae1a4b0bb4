package uk.gegc.skillgrader.features.exercise.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Start-up seeding of the exercise catalog.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "skillgrader.seed")
public class SeedProperties {

    private boolean enabled = true;

    @NotBlank
    private String exercisesLocation = "classpath:seed/exercises.json";
}
