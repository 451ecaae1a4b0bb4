package uk.gegc.skillgrader.features.similarity.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.skillgrader.features.similarity.domain.model.FuzzyMatch;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FuzzyTextMatcher")
class FuzzyTextMatcherTest {

    private final FuzzyTextMatcher matcher = new FuzzyTextMatcher();

    @Test
    @DisplayName("similarity ignores case and surrounding whitespace")
    void similarityNormalizes() {
        assertEquals(1.0, matcher.similarity("  Clarity ", "clarity"));
        assertEquals(1.0, matcher.similarity("", "   "));
    }

    @Test
    @DisplayName("similarity is one minus edit distance over the longer length")
    void similarityFromEditDistance() {
        // one deletion over twelve characters
        assertEquals(1.0 - 1.0 / 12, matcher.similarity("Completness", "Completeness"), 1e-9);
        assertEquals(0.0, matcher.similarity("abc", "xyz"), 1e-9);
    }

    @Test
    @DisplayName("containment lifts similarity to the containment floor")
    void containmentBoost() {
        double raw = matcher.similarity("Clarity of the Response", "Clarity");
        double effective = matcher.effectiveSimilarity("Clarity of the Response", "Clarity");

        assertThat(raw).isLessThan(FuzzyTextMatcher.CONTAINMENT_SIMILARITY);
        assertEquals(FuzzyTextMatcher.CONTAINMENT_SIMILARITY, effective);
    }

    @Test
    @DisplayName("findBestMatch returns the highest scoring pool entry above the threshold")
    void findBestMatchPicksHighest() {
        FuzzyMatch match = matcher.findBestMatch("Completness", List.of("Clarity", "Completeness", "Accuracy"), 0.7);

        assertTrue(match.isMatched());
        assertEquals("Completeness", match.match());
        assertThat(match.bestSimilarity()).isGreaterThan(0.9);
    }

    @Test
    @DisplayName("findBestMatch reports the best similarity even when nothing clears the threshold")
    void findBestMatchBelowThreshold() {
        FuzzyMatch match = matcher.findBestMatch("Tone", List.of("Clarity", "Accuracy"), 0.7);

        assertFalse(match.isMatched());
        assertNull(match.match());
        assertThat(match.bestSimilarity()).isBetween(0.0, 0.7);
        assertTrue(match.matchOptional().isEmpty());
    }

    @Test
    @DisplayName("findBestMatch on an empty pool is no match")
    void findBestMatchEmptyPool() {
        FuzzyMatch match = matcher.findBestMatch("Clarity", List.of(), 0.7);

        assertFalse(match.isMatched());
        assertEquals(0.0, match.bestSimilarity());
    }
}
