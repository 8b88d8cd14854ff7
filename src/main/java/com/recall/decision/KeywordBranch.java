package com.recall.decision;

import com.recall.query.TermMatcher;

import java.util.List;

/**
 * KeywordBranch - One branch of a procedure rule or decision tree: fires when any
 * of its keywords appears in the query.
 */
public class KeywordBranch {

    public final List<String> keywords;
    public final String text;
    public final int priority;

    public KeywordBranch(List<String> keywords, String text, int priority) {
        this.keywords = List.copyOf(keywords);
        this.text = text;
        this.priority = priority;
    }

    public boolean matches(String query) {
        return TermMatcher.containsAny(query, keywords);
    }
}
