package com.recall.decision;

import java.util.List;
import java.util.Optional;

/**
 * ProcedureRules - Fixed procedural sentences by scenario; the first scenario
 * whose trigger appears wins.
 */
public class ProcedureRules {

    private final List<ProcedureRule> rules;

    public ProcedureRules(List<ProcedureRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Optional<ProcedureRule> match(String query) {
        return rules.stream().filter(r -> r.matches(query)).findFirst();
    }

    public RecommendedAction action(ProcedureRule rule, String query) {
        return new RecommendedAction(rule.select(query), null, null, rule.priority, "procedure:" + rule.scenario);
    }
}
