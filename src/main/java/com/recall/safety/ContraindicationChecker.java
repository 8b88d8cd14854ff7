package com.recall.safety;

import com.recall.query.TermMatcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * ContraindicationChecker - Cross-references active conditions and recorded
 * allergies against the query and the candidate answer. A hit produces a
 * warning spoken alongside the answer; it never blocks it.
 */
public class ContraindicationChecker {

    private final List<ContraindicationRule> rules;
    private final String allergyWarningFormat;

    public ContraindicationChecker(List<ContraindicationRule> rules, String allergyWarningFormat) {
        this.rules = List.copyOf(rules);
        this.allergyWarningFormat = allergyWarningFormat;
    }

    public Optional<String> check(String query, Collection<String> conditions) {
        return check(query, "", conditions, Set.of());
    }

    public Optional<String> check(String query, String candidateResponse, Collection<String> conditions,
                                  Collection<String> allergies) {
        String q = query == null ? "" : query.toLowerCase();
        String answer = candidateResponse == null ? "" : candidateResponse.toLowerCase();
        List<String> warnings = new ArrayList<>();

        for (ContraindicationRule rule : rules) {
            if (conditions.contains(rule.condition)
                    && (TermMatcher.containsAny(q, rule.triggers) || TermMatcher.containsAny(answer, rule.triggers))
                    && !warnings.contains(rule.warning)) {
                warnings.add(rule.warning);
            }
        }
        for (String allergen : allergies) {
            if (TermMatcher.contains(q, allergen) || TermMatcher.contains(answer, allergen)) {
                warnings.add(String.format(allergyWarningFormat, allergen));
            }
        }
        return warnings.isEmpty() ? Optional.empty() : Optional.of(String.join("; ", warnings));
    }
}
