package uk.gegc.skillgrader.features.ensemble.domain.model;

import java.util.List;

/**
 * Output of an external consistency check (repeated or cross-model judging), accepted as-is.
 *
 * @param adjustedJudgmentWeight replaces the configured judgment weight when present
 * @param scoreDelta             added to the judgment score before combination when present
 */
public record ConsistencyOverride(
        Double adjustedJudgmentWeight,
        Integer scoreDelta,
        List<String> flags
) {

    public static ConsistencyOverride none() {
        return new ConsistencyOverride(null, null, List.of());
    }
}
