package uk.gegc.skillgrader.shared.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sizing of the in-process Caffeine caches.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "skillgrader.cache")
public class CacheProperties {

    @Positive
    private long embeddingMaxSize = 10_000;

    @NotNull
    private Duration embeddingTtl = Duration.ofHours(6);

    @Positive
    private long similarityMaxSize = 50_000;

    @NotNull
    private Duration similarityTtl = Duration.ofHours(6);
}
