package com.recall.query;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TermMatcher - Whole-word lookup of lowercase terms and phrases.
 * A letter on either side blocks a match; digits do not, so "80kilograms" still
 * finds "kilograms".
 */
public final class TermMatcher {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private TermMatcher() {
    }

    public static Pattern patternFor(String term) {
        return PATTERNS.computeIfAbsent(term,
            t -> Pattern.compile("(?<![a-z])" + Pattern.quote(t) + "(?![a-z])"));
    }

    public static boolean contains(String text, String term) {
        if (text == null || text.isEmpty() || term == null || term.isEmpty()) {
            return false;
        }
        return patternFor(term).matcher(text).find();
    }

    public static boolean containsAny(String text, Collection<String> terms) {
        return firstMatch(text, terms).isPresent();
    }

    public static Optional<String> firstMatch(String text, Collection<String> terms) {
        for (String term : terms) {
            if (contains(text, term)) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }

    public static String replaceAll(String text, String term, String replacement) {
        return patternFor(term).matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }
}
