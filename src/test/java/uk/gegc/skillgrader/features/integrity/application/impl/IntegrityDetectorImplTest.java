package uk.gegc.skillgrader.features.integrity.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.skillgrader.BaseUnitTest;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.integrity.domain.model.RiskLevel;
import uk.gegc.skillgrader.features.integrity.domain.model.SubmissionTiming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("IntegrityDetectorImpl")
class IntegrityDetectorImplTest extends BaseUnitTest {

    private static final String EXEMPLAR = "Use (\"java developer\" OR \"java engineer\") AND (spring OR hibernate) "
            + "NOT intern to focus on experienced backend candidates who list the frameworks we need.";

    private static final String ORIGINAL = "I started with the job title variants combined with OR, then narrowed the "
            + "results with AND on the core frameworks, and excluded junior profiles with NOT so the list stays senior.";

    private final IntegrityDetectorImpl detector = new IntegrityDetectorImpl();

    @Test
    @DisplayName("an original, substantial answer is low risk")
    void originalAnswer() {
        IntegrityVerdict verdict = detector.detectIntegrity(ORIGINAL, EXEMPLAR, 0.62, null);

        assertEquals(RiskLevel.LOW, verdict.riskLevel());
        assertTrue(verdict.likelyOriginal());
        assertThat(verdict.flags()).isEmpty();
        assertEquals(62, verdict.signals().exemplarCopyScore());
        assertEquals(0, verdict.signals().lowEffortIndicators());
    }

    @Test
    @DisplayName("exemplar text copied with different case and spacing is an exact copy")
    void exactCopyIgnoresCaseAndWhitespace() {
        String copied = "  " + EXEMPLAR.toUpperCase().replace(" ", "   ") + "\n";

        IntegrityVerdict verdict = detector.detectIntegrity(copied, EXEMPLAR, 0.2, null);

        assertTrue(verdict.isExactCopy());
        assertEquals(RiskLevel.HIGH, verdict.riskLevel());
        assertFalse(verdict.likelyOriginal());
        assertThat(verdict.flags()).contains("Exact copy of exemplar detected");
    }

    @Test
    @DisplayName("similarity above 0.95 to an exemplar counts as a copy")
    void nearCopyBySimilarity() {
        IntegrityVerdict verdict = detector.detectIntegrity(ORIGINAL, EXEMPLAR, 0.97, null);

        assertTrue(verdict.isExactCopy());
        assertEquals(RiskLevel.HIGH, verdict.riskLevel());
        assertThat(verdict.flags()).contains("Near-identical to exemplar (>95% similarity)");
    }

    @Test
    @DisplayName("high similarity without an exemplar is medium risk, not a copy")
    void highSimilarityWithoutExemplar() {
        IntegrityVerdict verdict = detector.detectIntegrity(ORIGINAL, null, 0.97, null);

        assertFalse(verdict.isExactCopy());
        assertEquals(RiskLevel.MEDIUM, verdict.riskLevel());
        assertFalse(verdict.likelyOriginal());
    }

    @Test
    @DisplayName("two low-effort indicators raise the risk to medium")
    void shortAndPlaceholder() {
        IntegrityVerdict verdict = detector.detectIntegrity("Dear {name}, join us.", EXEMPLAR, 0.1, null);

        assertTrue(verdict.signals().tooShort());
        assertTrue(verdict.signals().placeholders());
        assertEquals(2, verdict.signals().lowEffortIndicators());
        assertEquals(RiskLevel.MEDIUM, verdict.riskLevel());
        assertThat(verdict.flags()).contains("Submission is very short (< 15 words)", "Contains unfilled placeholders");
    }

    @Test
    @DisplayName("submitting in under 30% of the expected time is flagged")
    void tooFast() {
        IntegrityVerdict verdict = detector.detectIntegrity(ORIGINAL, null, 0.0, new SubmissionTiming(2_000L, 10_000L));

        assertTrue(verdict.signals().tooFast());
        assertEquals(1, verdict.signals().lowEffortIndicators());
        assertEquals(RiskLevel.LOW, verdict.riskLevel());
    }

    @Test
    @DisplayName("incomplete timing is ignored")
    void incompleteTimingIgnored() {
        IntegrityVerdict verdict = detector.detectIntegrity(ORIGINAL, null, 0.0, new SubmissionTiming(2_000L, null));

        assertFalse(verdict.signals().tooFast());
    }

    @Test
    @DisplayName("repeated sentences are detected")
    void repetitiveContent() {
        String repeated = "I would search LinkedIn for senior engineers. "
                + "I would search LinkedIn for senior engineers. "
                + "I would search LinkedIn for senior engineers. "
                + "I would search LinkedIn for senior engineers.";

        IntegrityVerdict verdict = detector.detectIntegrity(repeated, null, 0.0, null);

        assertTrue(verdict.signals().repetitivePatterns());
        assertThat(verdict.flags()).contains("Contains repetitive content");
    }

    @Test
    @DisplayName("null submission is treated as empty text")
    void nullSubmission() {
        IntegrityVerdict verdict = detector.detectIntegrity(null, EXEMPLAR, 0.0, null);

        assertTrue(verdict.signals().tooShort());
        assertFalse(verdict.isExactCopy());
    }

    @Test
    @DisplayName("out-of-range similarity is clamped")
    void similarityClamped() {
        IntegrityVerdict verdict = detector.detectIntegrity(ORIGINAL, null, 1.7, null);

        assertEquals(100, verdict.signals().exemplarCopyScore());
    }
}
