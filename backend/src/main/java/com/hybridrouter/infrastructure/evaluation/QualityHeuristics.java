package com.hybridrouter.infrastructure.evaluation;

import com.hybridrouter.domain.feedback.model.GenerationOutcome;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text heuristics shared by the validator and the reward scorer.
 */
public final class QualityHeuristics {

    public static final String WHY_IT_MATTERS = "why_it_matters";

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");

    // A figure ("0.25", "3 %", "12") or a date ("2026-03-01", "1.3.2026")
    private static final Pattern FIGURE_OR_DATE = Pattern.compile(
            "\\d{4}-\\d{1,2}-\\d{1,2}|\\d{1,2}\\.\\d{1,2}\\.\\d{4}|\\d+(?:[.,]\\d+)?\\s?%?");

    private static final int WORDS_PER_HEDGE = 50;

    private QualityHeuristics() {
    }

    public static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SENTENCE_SPLIT.split(text.trim()))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Fraction of sentences that are distinct (case-insensitive). 1.0 for empty text.
     */
    public static double distinctSentenceRatio(String text) {
        List<String> all = sentences(text);
        if (all.isEmpty()) {
            return 1.0;
        }
        Set<String> distinct = new LinkedHashSet<>();
        all.forEach(s -> distinct.add(s.toLowerCase(Locale.ROOT)));
        return (double) distinct.size() / all.size();
    }

    public static boolean hasFigureOrDate(String text) {
        return text != null && FIGURE_OR_DATE.matcher(text).find();
    }

    /**
     * 0.5 for a non-empty why-it-matters, plus 0.5 if it carries a figure or a date.
     */
    public static double analysisScore(GenerationOutcome outcome) {
        String why = outcome.field(WHY_IT_MATTERS);
        if (why.isBlank()) {
            return 0.0;
        }
        return hasFigureOrDate(why) ? 1.0 : 0.5;
    }

    /**
     * Density of hedged/unconfirmed phrasing: matches per 50 words, capped at 1.
     */
    public static double hedgeDensity(String text, List<String> hedgeTerms) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        long hits = hedgeTerms.stream().filter(lower::contains).count();
        double words = text.trim().split("\\s+").length;
        return Math.min(1.0, hits / Math.max(1.0, words / WORDS_PER_HEDGE));
    }

    public static boolean isResolvableReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(reference.trim());
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null && uri.getHost().contains(".");
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Share of references that are missing or unresolvable; 1.0 when there are none.
     */
    public static double referenceMissRate(List<String> references) {
        if (references.isEmpty()) {
            return 1.0;
        }
        long misses = references.stream().filter(r -> !isResolvableReference(r)).count();
        return (double) misses / references.size();
    }
}
