package com.recall.decision;

import com.recall.policy.ClinicalPolicy.RetrievalRules;
import com.recall.query.TermMatcher;

import java.util.regex.Pattern;

/**
 * GuidelineExtractor - Turns a retrieved corpus passage into one speakable answer:
 * strip headers and contributor blocks, then keep the first sentence with an
 * action verb, else the passage cut to the answer budget.
 */
public class GuidelineExtractor {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private final RetrievalRules rules;

    public GuidelineExtractor(RetrievalRules rules) {
        this.rules = rules;
    }

    public String extract(String passage) {
        String text = stripBoilerplate(passage);
        if (text.isEmpty()) {
            return "";
        }
        for (String sentence : SENTENCE_END.split(text)) {
            String trimmed = sentence.trim();
            if (!trimmed.isEmpty() && TermMatcher.containsAny(trimmed.toLowerCase(), rules.actionVerbs)) {
                return truncate(trimmed);
            }
        }
        return truncate(text);
    }

    public String stripBoilerplate(String passage) {
        String text = passage == null ? "" : passage;
        for (Pattern pattern : rules.boilerplatePatterns) {
            text = pattern.matcher(text).replaceAll(" ");
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    private String truncate(String text) {
        if (text.length() <= rules.maxAnswerChars) {
            return text;
        }
        String cut = text.substring(0, rules.maxAnswerChars);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > rules.maxAnswerChars / 2) {
            cut = cut.substring(0, lastSpace);
        }
        return cut.trim() + "...";
    }
}
