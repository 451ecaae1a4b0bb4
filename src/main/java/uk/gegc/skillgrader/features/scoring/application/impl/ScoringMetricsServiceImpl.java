package uk.gegc.skillgrader.features.scoring.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.integrity.domain.model.RiskLevel;
import uk.gegc.skillgrader.features.scoring.application.ScoringMetricsService;

/**
 * Micrometer-backed scoring counters.
 */
@Slf4j
@Service
public class ScoringMetricsServiceImpl implements ScoringMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter evaluationsCounter;
    private final Counter malformedJudgmentCounter;
    private final Counter referenceAddedCounter;
    private final Counter referenceRejectedCounter;
    private final Counter crossExerciseFallbackCounter;
    private final Counter referenceLookupFailureCounter;

    public ScoringMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.evaluationsCounter = Counter.builder("scoring.evaluations")
                .description("Number of submissions evaluated")
                .register(meterRegistry);
        this.malformedJudgmentCounter = Counter.builder("scoring.judgments.malformed")
                .description("Number of judgments that failed schema validation")
                .register(meterRegistry);
        this.referenceAddedCounter = Counter.builder("references.inserts.added")
                .description("Number of references added to the bank")
                .register(meterRegistry);
        this.referenceRejectedCounter = Counter.builder("references.inserts.rejected")
                .description("Number of reference candidates rejected")
                .register(meterRegistry);
        this.crossExerciseFallbackCounter = Counter.builder("references.pool.cross_exercise_fallback")
                .description("Number of pool resolutions that borrowed cross-exercise evidence")
                .register(meterRegistry);
        this.referenceLookupFailureCounter = Counter.builder("references.pool.lookup_failures")
                .description("Number of failed reference lookups")
                .register(meterRegistry);
    }

    @Override
    public void recordEvaluation(RiskLevel riskLevel, boolean judgmentMalformed) {
        evaluationsCounter.increment();
        if (judgmentMalformed) {
            malformedJudgmentCounter.increment();
        }
        if (riskLevel != null) {
            meterRegistry.counter("scoring.integrity.risk", "level", riskLevel.code()).increment();
        }
        log.debug("Recorded evaluation metric: risk={}, malformed={}", riskLevel, judgmentMalformed);
    }

    @Override
    public void recordReferenceInsert(boolean added) {
        if (added) {
            referenceAddedCounter.increment();
        } else {
            referenceRejectedCounter.increment();
        }
    }

    @Override
    public void recordCrossExerciseFallback() {
        crossExerciseFallbackCounter.increment();
    }

    @Override
    public void recordReferenceLookupFailure() {
        referenceLookupFailureCounter.increment();
    }
}
