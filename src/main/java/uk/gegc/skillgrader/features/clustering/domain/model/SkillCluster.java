package uk.gegc.skillgrader.features.clustering.domain.model;

import java.util.List;

/**
 * Exercises sharing a skill category.
 *
 * @param averageDifficulty mean difficulty tier, 1 (easy) to 3 (hard)
 */
public record SkillCluster(
        String clusterId,
        String clusterName,
        String primarySkill,
        List<String> exerciseIds,
        double averageDifficulty,
        int exerciseCount
) {
}
