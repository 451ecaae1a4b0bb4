package uk.gegc.skillgrader.features.reference.application.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.skillgrader.BaseUnitTest;
import uk.gegc.skillgrader.features.reference.application.ReferencePersistence;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceMatchConfig;
import uk.gegc.skillgrader.features.similarity.application.SimilarityKernel;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ReferencePoolStrategyRegistry")
class ReferencePoolStrategyRegistryTest extends BaseUnitTest {

    @Mock
    private ReferencePersistence referencePersistence;

    private final SimilarityKernel kernel = new SimilarityKernel();

    @Test
    @DisplayName("orders strategies with the direct tier first")
    void ordersDirectFirst() {
        ReferencePoolStrategyRegistry registry = new ReferencePoolStrategyRegistry(List.of(
                new CrossExercisePoolStrategy(referencePersistence, kernel),
                new DirectPoolStrategy(referencePersistence, kernel)
        ));

        assertEquals(PoolTier.DIRECT, registry.ordered().get(0).tier());
        assertEquals(PoolTier.CROSS_EXERCISE, registry.ordered().get(1).tier());
    }

    @Test
    @DisplayName("refuses to start without a direct strategy")
    void requiresDirect() {
        List<ReferencePoolStrategy> crossOnly = List.of(new CrossExercisePoolStrategy(referencePersistence, kernel));

        assertThrows(IllegalStateException.class, () -> new ReferencePoolStrategyRegistry(crossOnly));
    }

    @Test
    @DisplayName("cross-exercise tier is gated on the fallback minimum and the enabled flag")
    void crossExerciseGate() {
        CrossExercisePoolStrategy cross = new CrossExercisePoolStrategy(referencePersistence, kernel);
        ReferenceMatchConfig defaults = ReferenceMatchConfig.defaults();
        ReferenceMatchConfig disabled = new ReferenceMatchConfig(80, 10, 0.70, false, 3, 0.10, 0.05, 0.60, 0.7, 15);

        assertTrue(cross.isRequired(2, defaults));
        assertFalse(cross.isRequired(3, defaults));
        assertFalse(cross.isRequired(0, disabled));
        assertEquals(0.7, cross.weightMultiplier(defaults));
    }
}
