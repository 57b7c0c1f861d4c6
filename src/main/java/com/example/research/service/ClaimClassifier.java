package com.example.research.service;

import com.example.research.model.ClaimType;
import com.example.research.model.Confidence;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Wording heuristics for claim confidence and claim type.
 * <p>
 * The marker lists, the precedence of claim types and the factual-marker thresholds
 * are tunable heuristics; changing them changes the artifacts produced.
 */
public final class ClaimClassifier {

    /** Hedging markers, matched against lower-cased text. Any hit means {@code uncertain}. */
    public static final List<String> UNCERTAINTY_MARKERS = List.of(
            "[uncertain]", "may be", "might ", "possibly", "reportedly",
            "some sources", "it appears", "seems to");

    /** Factual markers; each pattern counts at most once. */
    public static final List<Pattern> FACTUAL_MARKERS = List.of(
            Pattern.compile("\\d+(?:\\.\\d+)?%"),
            Pattern.compile("\\$\\d[\\d,]*(?:\\.\\d+)?"),
            Pattern.compile("\\bin \\d{4}\\b"),
            Pattern.compile("according to"),
            Pattern.compile("study found"),
            Pattern.compile("data shows"));

    public static final int HIGH_CONFIDENCE_MARKERS = 2;

    public static final List<String> PREDICTION_MARKERS = List.of("will ", "expect", "forecast", "predict");
    public static final List<String> DEFINITION_MARKERS = List.of("is defined as", "refers to", "means that");
    public static final List<String> OPINION_MARKERS = List.of("should", "ought", "better", "worse", "best", "worst");

    private ClaimClassifier() {
    }

    public static Confidence confidence(String text) {
        String folded = text.toLowerCase(Locale.ROOT);
        if (containsAny(folded, UNCERTAINTY_MARKERS)) {
            return Confidence.UNCERTAIN;
        }
        long hits = FACTUAL_MARKERS.stream().filter(p -> p.matcher(folded).find()).count();
        if (hits >= HIGH_CONFIDENCE_MARKERS) return Confidence.HIGH;
        if (hits == 1) return Confidence.MEDIUM;
        return Confidence.LOW;
    }

    /** First match wins: prediction, definition, opinion, then factual. */
    public static ClaimType claimType(String text) {
        String folded = text.toLowerCase(Locale.ROOT);
        if (containsAny(folded, PREDICTION_MARKERS)) return ClaimType.PREDICTION;
        if (containsAny(folded, DEFINITION_MARKERS)) return ClaimType.DEFINITION;
        if (containsAny(folded, OPINION_MARKERS)) return ClaimType.OPINION;
        return ClaimType.FACTUAL;
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) return true;
        }
        return false;
    }
}
