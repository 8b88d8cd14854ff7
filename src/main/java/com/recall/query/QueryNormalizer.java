package com.recall.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * QueryNormalizer - Deterministic cleanup of a spoken query.
 *
 * <p>{@link #clean(String)} lowercases, strips punctuation, applies the ordered
 * correction table and the contextual rewrites. {@link #expand(String)} appends
 * domain synonyms for retrieval. Patient extraction and the rule tables read the
 * cleaned form only, so expansion words never turn into patient data.
 */
public class QueryNormalizer {

    private static final Logger log = LoggerFactory.getLogger(QueryNormalizer.class);

    private final List<Correction> corrections;
    private final List<ContextualRewriteRule> rewrites;
    private final List<Expansion> expansions;

    public QueryNormalizer(List<Correction> corrections, List<ContextualRewriteRule> rewrites,
                           List<Expansion> expansions) {
        this.corrections = List.copyOf(corrections);
        this.rewrites = List.copyOf(rewrites);
        this.expansions = List.copyOf(expansions);
    }

    public String normalize(String raw) {
        return expand(clean(raw));
    }

    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.toLowerCase()
            .replace("'", "")
            .replace("’", "");
        // Keep decimal points and blood-pressure slashes, drop everything else.
        text = text.replaceAll("(?<!\\d)\\.|\\.(?!\\d)", " ")
            .replaceAll("[^a-z0-9./\\s]", " ");
        text = collapse(text);

        for (Correction correction : corrections) {
            text = TermMatcher.replaceAll(text, correction.from, correction.to);
        }
        for (ContextualRewriteRule rule : rewrites) {
            String rewritten = rule.apply(text);
            if (!rewritten.equals(text)) {
                log.debug("Contextual rewrite {} -> {} applied", rule.token, rule.replacement);
                text = rewritten;
            }
        }
        return collapse(text);
    }

    public String expand(String cleaned) {
        if (cleaned == null || cleaned.isEmpty()) {
            return "";
        }
        Set<String> added = new LinkedHashSet<>();
        for (Expansion expansion : expansions) {
            if (TermMatcher.contains(cleaned, expansion.trigger)) {
                added.addAll(expansion.terms);
            }
        }
        if (added.isEmpty()) {
            return cleaned;
        }
        List<String> parts = new ArrayList<>();
        parts.add(cleaned);
        parts.addAll(added);
        return collapse(String.join(" ", parts));
    }

    private static String collapse(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    /** Literal whole-word replacement for a known misrecognition or unit word. */
    public static class Correction {
        public final String from;
        public final String to;

        public Correction(String from, String to) {
            this.from = from;
            this.to = to;
        }
    }

    /** Synonyms appended once when the trigger appears. */
    public static class Expansion {
        public final String trigger;
        public final List<String> terms;

        public Expansion(String trigger, List<String> terms) {
            this.trigger = trigger;
            this.terms = List.copyOf(terms);
        }
    }
}
