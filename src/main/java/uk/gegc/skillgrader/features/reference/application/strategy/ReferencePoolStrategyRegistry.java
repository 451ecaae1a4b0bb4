package uk.gegc.skillgrader.features.reference.application.strategy;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Component
public class ReferencePoolStrategyRegistry {

    private final List<ReferencePoolStrategy> strategies;

    public ReferencePoolStrategyRegistry(List<ReferencePoolStrategy> strategies) {
        this.strategies = strategies.stream()
                .sorted(Comparator.comparing(ReferencePoolStrategy::tier))
                .toList();
        if (this.strategies.isEmpty() || this.strategies.get(0).tier() != PoolTier.DIRECT) {
            throw new IllegalStateException("A direct pool strategy is required");
        }
    }

    /**
     * Strategies in evaluation order, direct first.
     */
    public List<ReferencePoolStrategy> ordered() {
        return strategies;
    }
}
