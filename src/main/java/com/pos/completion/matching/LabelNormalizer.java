package com.pos.completion.matching;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String and token helpers shared by the identity and model matchers.
 *
 * Every method accepts {@code null} and never throws.
 */
public final class LabelNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{IsAlphabetic}\\p{IsDigit}]");

    // Tokens of this length or shorter carry no discriminating value
    private static final int MAX_SHORT_TOKEN_LENGTH = 2;

    private LabelNormalizer() {
    }

    /**
     * Lower-cases, trims and collapses internal whitespace to single spaces.
     *
     * @return the normalized label, or {@code ""} for null/blank input
     */
    public static String normalizeLabel(String s) {
        if (s == null) {
            return "";
        }
        String trimmed = s.toLowerCase(Locale.ROOT).strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(trimmed).replaceAll(" ");
    }

    /**
     * Normalizes a model name for punctuation- and spacing-insensitive comparison:
     * {@code "Galaxy S24-Ultra"} becomes {@code "galaxys24ultra"}.
     */
    public static String normalizeModelToken(String s) {
        return NON_ALPHANUMERIC.matcher(normalizeLabel(s)).replaceAll("");
    }

    /**
     * Splits the normalized label on spaces, keeping only tokens longer than two
     * characters. Iteration order follows the label.
     */
    public static Set<String> tokenize(String s) {
        return words(s).stream()
                .filter(token -> token.length() > MAX_SHORT_TOKEN_LENGTH)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Splits the normalized label on spaces without dropping short tokens.
     */
    public static Set<String> words(String s) {
        String normalized = normalizeLabel(s);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(Arrays.asList(normalized.split(" ")));
    }

    /**
     * Jaccard similarity |A ∩ B| / |A ∪ B|; 0.0 when both sets are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        return (double) sharedCount(a, b) / unionCount(a, b);
    }

    public static int sharedCount(Set<String> a, Set<String> b) {
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return shared;
    }

    private static int unionCount(Set<String> a, Set<String> b) {
        return a.size() + b.size() - sharedCount(a, b);
    }

    /**
     * @return whether the (already normalized) label ends in a digit, as in
     * numbered branches like {@code "mobile center branch 2"}
     */
    public static boolean endsWithDigit(String normalized) {
        return !normalized.isEmpty() && Character.isDigit(normalized.charAt(normalized.length() - 1));
    }
}
