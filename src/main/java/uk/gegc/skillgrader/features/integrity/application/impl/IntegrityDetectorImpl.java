package uk.gegc.skillgrader.features.integrity.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.skillgrader.features.integrity.application.IntegrityDetector;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegritySignals;
import uk.gegc.skillgrader.features.integrity.domain.model.IntegrityVerdict;
import uk.gegc.skillgrader.features.integrity.domain.model.RiskLevel;
import uk.gegc.skillgrader.features.integrity.domain.model.SubmissionTiming;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rule cascade for copy and low-effort detection. Each rule is evaluated independently; the risk tier
 * is taken from the first matching level.
 */
@Slf4j
@Service
public class IntegrityDetectorImpl implements IntegrityDetector {

    static final double NEAR_COPY_SIMILARITY = 0.95;
    static final double MEDIUM_RISK_SIMILARITY = 0.9;
    static final int MIN_WORD_COUNT = 15;
    static final int MIN_SENTENCE_LENGTH = 10;
    static final int REPETITION_MIN_SENTENCES = 3;
    static final double REPETITION_UNIQUE_RATIO = 0.6;
    static final double TOO_FAST_RATIO = 0.3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_TERMINATORS = Pattern.compile("[.!?]+");

    private static final List<Pattern> PLACEHOLDER_PATTERNS = List.of(
            Pattern.compile("\\[your (answer|response|name|company)]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\{(name|company|role)}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.\\.\\.\\s*$"),
            Pattern.compile("^e\\.g\\.,?\\s", Pattern.CASE_INSENSITIVE),
            Pattern.compile("lorem ipsum", Pattern.CASE_INSENSITIVE),
            Pattern.compile("xxx+", Pattern.CASE_INSENSITIVE)
    );

    @Override
    public IntegrityVerdict detectIntegrity(String submission,
                                            String exemplar,
                                            double embeddingSimilarity,
                                            SubmissionTiming timing) {
        String text = submission == null ? "" : submission;
        double similarity = clampUnit(embeddingSimilarity);
        List<String> flags = new ArrayList<>();
        int lowEffortIndicators = 0;

        boolean exactCopy = false;
        if (exemplar != null && !exemplar.isBlank()) {
            if (normalize(text).equals(normalize(exemplar))) {
                exactCopy = true;
                flags.add("Exact copy of exemplar detected");
            } else if (similarity > NEAR_COPY_SIMILARITY) {
                exactCopy = true;
                flags.add("Near-identical to exemplar (>95% similarity)");
            }
        }

        boolean tooShort = wordCount(text) < MIN_WORD_COUNT;
        if (tooShort) {
            lowEffortIndicators++;
            flags.add("Submission is very short (< " + MIN_WORD_COUNT + " words)");
        }

        boolean repetitive = hasRepetitivePatterns(text);
        if (repetitive) {
            lowEffortIndicators++;
            flags.add("Contains repetitive content");
        }

        boolean tooFast = false;
        if (timing != null && timing.isComplete()
                && timing.submissionTimeMs() < timing.minExpectedTimeMs() * TOO_FAST_RATIO) {
            tooFast = true;
            lowEffortIndicators++;
            flags.add("Submitted unusually quickly");
        }

        boolean placeholders = PLACEHOLDER_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
        if (placeholders) {
            lowEffortIndicators++;
            flags.add("Contains unfilled placeholders");
        }

        RiskLevel riskLevel;
        if (exactCopy) {
            riskLevel = RiskLevel.HIGH;
        } else if (lowEffortIndicators >= 2 || similarity > MEDIUM_RISK_SIMILARITY) {
            riskLevel = RiskLevel.MEDIUM;
        } else {
            riskLevel = RiskLevel.LOW;
        }

        IntegritySignals signals = new IntegritySignals(
                (int) Math.round(similarity * 100),
                exactCopy,
                tooShort,
                tooFast,
                repetitive,
                placeholders,
                lowEffortIndicators
        );

        if (riskLevel != RiskLevel.LOW) {
            log.debug("Integrity risk detected: risk={}, indicators={}, flags={}", riskLevel, lowEffortIndicators, flags);
        }

        return new IntegrityVerdict(
                riskLevel,
                riskLevel == RiskLevel.LOW && !exactCopy,
                List.copyOf(flags),
                signals
        );
    }

    private static boolean hasRepetitivePatterns(String text) {
        List<String> sentences = Arrays.stream(SENTENCE_TERMINATORS.split(text))
                .map(String::trim)
                .filter(s -> s.length() > MIN_SENTENCE_LENGTH)
                .toList();
        long unique = sentences.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .distinct()
                .count();
        return sentences.size() > REPETITION_MIN_SENTENCES && unique < sentences.size() * REPETITION_UNIQUE_RATIO;
    }

    private static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    private static String normalize(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
