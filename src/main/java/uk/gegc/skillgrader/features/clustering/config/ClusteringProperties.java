package uk.gegc.skillgrader.features.clustering.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exercise clustering and progression insight settings.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "skillgrader.clustering")
public class ClusteringProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minSimilarity = 0.5;

    @Positive
    private int relatedLimit = 5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double contentWeight = 0.50;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double skillWeight = 0.35;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double difficultyWeight = 0.15;

    /**
     * Content similarity above which exercises from different skills count as variations.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double variationThreshold = 0.7;

    private int masteryScore = 85;

    private int proficientScore = 70;

    /**
     * Attempts needed before a declining trend is reported.
     */
    private int decliningMinAttempts = 3;

    /**
     * Tag name to case-insensitive regular expression matched against exercise title and description.
     */
    @NotNull
    private Map<String, String> skillTagPatterns = defaultSkillTagPatterns();

    private static Map<String, String> defaultSkillTagPatterns() {
        Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("boolean-operators", "\\b(and|or|not|boolean)\\b");
        patterns.put("linkedin", "\\blinkedin\\b");
        patterns.put("github", "\\bgithub\\b");
        patterns.put("x-ray", "\\bx.?ray\\b");
        patterns.put("outreach", "\\b(outreach|message|email|cold)\\b");
        patterns.put("diversity", "\\b(diversity|dei|inclusion|equity)\\b");
        patterns.put("persona", "\\b(persona|profile|candidate)\\b");
        patterns.put("negotiation", "\\b(negotiat\\w*|offer|salary|compensation)\\b");
        patterns.put("sourcing", "\\b(sourcing|source|talent)\\b");
        patterns.put("screening", "\\b(screen\\w*|resume|cv)\\b");
        patterns.put("data", "\\b(data|analytic\\w*|metrics?)\\b");
        return patterns;
    }
}
