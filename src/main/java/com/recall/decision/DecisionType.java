package com.recall.decision;

/**
 * DecisionType - Which step of the resolver produced the answer.
 */
public enum DecisionType {
    VITALS_SUMMARY,
    STALE_VITALS,
    CRITICAL_VITALS,
    MEDICATION,
    GUIDELINE_DOSE,
    PROCEDURE,
    DECISION_TREE,
    RETRIEVAL,
    CLARIFYING;

    /** Prompts and warnings are spoken verbatim, not assembled from action points. */
    public boolean isVerbatim() {
        return this == STALE_VITALS || this == CLARIFYING || this == VITALS_SUMMARY;
    }
}
