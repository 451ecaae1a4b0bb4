package uk.gegc.skillgrader.features.similarity.application;

import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.similarity.domain.model.FuzzyMatch;

import java.util.Collection;
import java.util.Locale;

/**
 * Edit-distance based label similarity used to reconcile judge output against canonical rubric names.
 */
@Component
public class FuzzyTextMatcher {

    /**
     * Floor applied when one label contains the other, e.g. "Clarity of the Response" vs "Clarity".
     */
    public static final double CONTAINMENT_SIMILARITY = 0.85;

    /**
     * Case-insensitive, trimmed similarity {@code 1 - levenshtein / maxLength}.
     */
    public double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);

        if (left.equals(right)) {
            return 1.0;
        }
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshteinDistance(left, right) / maxLength;
    }

    /**
     * Similarity with the containment boost applied.
     */
    public double effectiveSimilarity(String candidate, String canonical) {
        double similarity = similarity(candidate, canonical);
        String left = normalize(candidate);
        String right = normalize(canonical);
        boolean contains = left.contains(right) || right.contains(left);
        return contains ? Math.max(similarity, CONTAINMENT_SIMILARITY) : similarity;
    }

    public FuzzyMatch findBestMatch(String candidateLabel, Collection<String> pool, double threshold) {
        String best = null;
        double bestSimilarity = 0.0;

        if (pool != null) {
            for (String entry : pool) {
                double similarity = effectiveSimilarity(candidateLabel, entry);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    best = entry;
                }
            }
        }

        if (best != null && bestSimilarity >= threshold) {
            return new FuzzyMatch(best, bestSimilarity);
        }
        return FuzzyMatch.none(bestSimilarity);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private static int levenshteinDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
