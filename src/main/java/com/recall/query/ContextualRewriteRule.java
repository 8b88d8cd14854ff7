package com.recall.query;

import java.util.List;

/**
 * ContextualRewriteRule - Rewrites an ambiguous short token to its clinical form,
 * but only when one of the indicator words appears in the same query.
 *
 * <p>The indicator list is a heuristic and needs clinical validation before it grows.
 */
public class ContextualRewriteRule {

    public final String token;
    public final String replacement;
    public final List<String> indicators;

    public ContextualRewriteRule(String token, String replacement, List<String> indicators) {
        this.token = token;
        this.replacement = replacement;
        this.indicators = List.copyOf(indicators);
    }

    public boolean appliesTo(String text) {
        if (!TermMatcher.contains(text, token)) {
            return false;
        }
        for (String indicator : indicators) {
            if (!indicator.equals(token) && TermMatcher.contains(text, indicator)) {
                return true;
            }
        }
        return false;
    }

    public String apply(String text) {
        return appliesTo(text) ? TermMatcher.replaceAll(text, token, replacement) : text;
    }

    @Override
    public String toString() {
        return String.format("ContextualRewriteRule{%s -> %s, indicators=%s}", token, replacement, indicators);
    }
}
