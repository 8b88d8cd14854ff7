package com.recall.decision;

import com.recall.query.TermMatcher;

import java.util.List;

/**
 * ProcedureRule - Scenario triggers with severity branches, each a fixed
 * procedural sentence. {@code preferTree} hands the scenario to its decision tree.
 */
public class ProcedureRule {

    public final String scenario;
    public final List<String> triggers;
    public final int priority;
    public final boolean preferTree;
    public final List<KeywordBranch> branches;
    public final String defaultText;

    public ProcedureRule(String scenario, List<String> triggers, int priority, boolean preferTree,
                         List<KeywordBranch> branches, String defaultText) {
        this.scenario = scenario;
        this.triggers = List.copyOf(triggers);
        this.priority = priority;
        this.preferTree = preferTree;
        this.branches = List.copyOf(branches);
        this.defaultText = defaultText;
    }

    public boolean matches(String query) {
        return TermMatcher.containsAny(query, triggers);
    }

    public String select(String query) {
        for (KeywordBranch branch : branches) {
            if (branch.matches(query)) {
                return branch.text;
            }
        }
        return defaultText;
    }
}
