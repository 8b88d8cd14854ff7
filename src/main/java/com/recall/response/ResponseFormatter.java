package com.recall.response;

import com.recall.decision.Decision;
import com.recall.decision.RecommendedAction;
import com.recall.policy.ClinicalPolicy.FormatterRules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ResponseFormatter - Assembles the final speakable sentence from a decision.
 * Repeated facts are dropped, at most {@code maxActions} points survive and each
 * is cut to the description budget with an ellipsis.
 */
public class ResponseFormatter {

    private static final String ELLIPSIS = "...";

    private final FormatterRules rules;

    public ResponseFormatter(FormatterRules rules) {
        this.rules = rules;
    }

    public String format(Decision decision) {
        if (decision.type.isVerbatim() && decision.primary() != null) {
            return decision.primary().text;
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> parts = new ArrayList<>();
        for (RecommendedAction action : decision.recommendations) {
            if (parts.size() >= rules.maxActions) {
                break;
            }
            String text = stripTrailingPeriods(action.text == null ? "" : action.text.trim());
            if (text.isEmpty() || !seen.add(action.dedupKey())) {
                continue;
            }
            parts.add(truncate(text));
        }
        if (parts.isEmpty()) {
            return rules.emptyText;
        }
        String joined = String.join(". ", parts);
        return joined.endsWith(".") ? joined : joined + ".";
    }

    String truncate(String text) {
        if (text.length() <= rules.maxDescriptionChars) {
            return text;
        }
        return text.substring(0, rules.maxDescriptionChars - ELLIPSIS.length()).trim() + ELLIPSIS;
    }

    private static String stripTrailingPeriods(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end).trim();
    }
}
