package uk.gegc.skillgrader.features.ensemble.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.ensemble.application.EnsembleScorer;
import uk.gegc.skillgrader.features.ensemble.config.EnsembleProperties;
import uk.gegc.skillgrader.features.ensemble.domain.model.ComponentWeights;
import uk.gegc.skillgrader.features.ensemble.domain.model.ConfidenceBand;
import uk.gegc.skillgrader.features.ensemble.domain.model.ConsistencyOverride;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleResult;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleSignals;
import uk.gegc.skillgrader.features.ensemble.domain.model.EnsembleWeights;
import uk.gegc.skillgrader.features.ensemble.domain.model.ScoreRange;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.integrity.domain.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnsembleScorerImpl implements EnsembleScorer {

    static final int EXACT_COPY_CAP = 50;
    static final double HIGH_RISK_FACTOR = 0.85;
    static final double MEDIUM_RISK_FACTOR = 0.95;
    static final double PERFECT_SCORE_SIMILARITY = 0.95;

    private final EnsembleProperties ensembleProperties;

    @Override
    public EnsembleResult combineEnsemble(EnsembleSignals signals) {
        return combineEnsemble(signals, ensembleProperties.toWeights());
    }

    @Override
    public EnsembleResult combineEnsemble(EnsembleSignals signals, EnsembleWeights weights) {
        List<String> adjustments = new ArrayList<>();
        ConsistencyOverride consistency = signals.consistency() != null ? signals.consistency() : ConsistencyOverride.none();

        Double judgment = signals.judgmentScore() != null ? clamp(signals.judgmentScore()) : null;
        if (judgment != null && consistency.scoreDelta() != null && consistency.scoreDelta() != 0) {
            double shifted = clamp(judgment + consistency.scoreDelta());
            adjustments.add(String.format("Cross-validation delta %+d applied to judgment score (%d -> %d)",
                    consistency.scoreDelta(), Math.round(judgment), Math.round(shifted)));
            judgment = shifted;
        }
        Double validator = signals.validatorScore() != null ? clamp(signals.validatorScore()) : null;
        Double embedding = signals.hasExemplar() && signals.embeddingSimilarity() != null
                ? clamp(signals.embeddingSimilarity() * 100)
                : null;

        double judgmentWeight = judgment == null ? 0.0
                : consistency.adjustedJudgmentWeight() != null
                ? Math.max(0.0, consistency.adjustedJudgmentWeight())
                : weights.judgment();
        double validatorWeight = validator == null ? 0.0 : weights.validator();
        double embeddingWeight = embedding == null ? 0.0 : weights.embedding();
        double totalWeight = judgmentWeight + validatorWeight + embeddingWeight;

        if (totalWeight <= 0) {
            adjustments.add("No scoring signals available");
            log.warn("Ensemble combined without any available signal");
            return new EnsembleResult(0, 0, 0, ConfidenceBand.LOW, new ScoreRange(0, 0),
                    ComponentWeights.none(), 0, adjustments);
        }

        ComponentWeights componentWeights = new ComponentWeights(
                judgmentWeight / totalWeight,
                validatorWeight / totalWeight,
                embeddingWeight / totalWeight
        );

        List<Double> active = new ArrayList<>();
        double combined = 0.0;
        if (judgment != null && componentWeights.judgment() > 0) {
            combined += componentWeights.judgment() * judgment;
            active.add(judgment);
        }
        if (validator != null && componentWeights.validator() > 0) {
            combined += componentWeights.validator() * validator;
            active.add(validator);
        }
        if (embedding != null && componentWeights.embedding() > 0) {
            combined += componentWeights.embedding() * embedding;
            active.add(embedding);
        }
        int preAdjustment = (int) Math.round(clamp(combined));

        double stdDev = populationStdDev(active);
        double spread = active.isEmpty() ? 0.0
                : active.stream().mapToDouble(Double::doubleValue).max().orElse(0)
                - active.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        int agreement = (int) Math.round(clamp(100 - 2 * stdDev));
        int confidence = (int) Math.round(clamp(100 - 1.5 * stdDev - 0.3 * spread));

        int score = preAdjustment;
        if (signals.referenceAdjustment() != 0) {
            int adjusted = (int) clamp(score + signals.referenceAdjustment());
            adjustments.add(String.format("Reference pool adjustment %+d (%d -> %d)",
                    signals.referenceAdjustment(), score, adjusted));
            score = adjusted;
        }

        score = applyIntegrity(score, signals.integrity(), adjustments);

        if (score >= 100 && !isPerfectScoreEarned(validator, signals)) {
            adjustments.add("Perfect score requires validator 100 and exemplar similarity >= 0.95; capped at 99");
            score = 99;
        }
        int finalScore = (int) clamp(score);

        long margin = Math.round(1.5 * stdDev);
        ScoreRange range = new ScoreRange(
                (int) clamp(finalScore - margin),
                (int) clamp(finalScore + margin)
        );

        log.debug("Ensemble combined: signals={}, preAdjustment={}, final={}, stdDev={}, confidence={}",
                active.size(), preAdjustment, finalScore, String.format("%.2f", stdDev), confidence);

        return new EnsembleResult(
                finalScore,
                preAdjustment,
                confidence,
                ConfidenceBand.fromConfidence(confidence),
                range,
                componentWeights,
                agreement,
                List.copyOf(adjustments)
        );
    }

    private int applyIntegrity(int score, IntegrityVerdict integrity, List<String> adjustments) {
        if (integrity == null) {
            return score;
        }
        if (integrity.isExactCopy()) {
            if (score > EXACT_COPY_CAP) {
                adjustments.add("Exact copy of exemplar: score capped at " + EXACT_COPY_CAP);
                return EXACT_COPY_CAP;
            }
            return score;
        }
        if (integrity.riskLevel() == RiskLevel.HIGH) {
            int reduced = (int) Math.round(score * HIGH_RISK_FACTOR);
            adjustments.add("High integrity risk: 15% reduction (" + score + " -> " + reduced + ")");
            return reduced;
        }
        if (integrity.riskLevel() == RiskLevel.MEDIUM) {
            int reduced = (int) Math.round(score * MEDIUM_RISK_FACTOR);
            adjustments.add("Medium integrity risk: 5% reduction (" + score + " -> " + reduced + ")");
            return reduced;
        }
        return score;
    }

    private static boolean isPerfectScoreEarned(Double validator, EnsembleSignals signals) {
        return validator != null
                && validator >= 100
                && signals.embeddingSimilarity() != null
                && signals.embeddingSimilarity() >= PERFECT_SCORE_SIMILARITY;
    }

    private static double populationStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream()
                .mapToDouble(value -> (value - mean) * (value - mean))
                .average()
                .orElse(0.0);
        return Math.sqrt(variance);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
