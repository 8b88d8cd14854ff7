package com.recall.decision;

import com.recall.query.TermMatcher;

import java.util.List;

/**
 * DecisionTree - Guideline-backed answer for a scenario, branching on secondary keywords.
 */
public class DecisionTree {

    public final String scenario;
    public final List<String> triggers;
    public final List<KeywordBranch> branches;
    public final KeywordBranch defaultBranch;

    public DecisionTree(String scenario, List<String> triggers, List<KeywordBranch> branches,
                        KeywordBranch defaultBranch) {
        this.scenario = scenario;
        this.triggers = List.copyOf(triggers);
        this.branches = List.copyOf(branches);
        this.defaultBranch = defaultBranch;
    }

    public boolean matches(String query) {
        return TermMatcher.containsAny(query, triggers);
    }

    public KeywordBranch walk(String query) {
        for (KeywordBranch branch : branches) {
            if (branch.matches(query)) {
                return branch;
            }
        }
        return defaultBranch;
    }
}
