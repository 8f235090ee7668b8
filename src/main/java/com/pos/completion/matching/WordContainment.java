package com.pos.completion.matching;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Whole-word containment check shared by the identifier-in-name strategies.
 *
 * Needles are store ids and leader labels, so the pattern cache is bounded by
 * the catalog and survey vocabulary.
 */
final class WordContainment {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private WordContainment() {
    }

    /**
     * @return whether {@code needle} is at least {@code minLength} characters,
     * occurs in {@code haystack} bounded by word boundaries, and {@code haystack}
     * holds more than the needle alone
     */
    static boolean containsWord(String haystack, String needle, int minLength) {
        if (needle.length() < minLength || haystack.length() <= needle.length()) {
            return false;
        }
        return wordPattern(needle).matcher(haystack).find();
    }

    static Pattern wordPattern(String needle) {
        return PATTERNS.computeIfAbsent(needle,
                n -> Pattern.compile("\\b" + Pattern.quote(n) + "\\b", Pattern.UNICODE_CHARACTER_CLASS));
    }
}
