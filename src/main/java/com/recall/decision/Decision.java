package com.recall.decision;

import com.recall.retrieval.ScoredEntry;

import java.util.List;
import java.util.Map;

/**
 * Decision - Outcome of one resolver pass. Produced and consumed within a turn.
 *
 * <p>{@code notices} are non-blocking advisories (missing vitals, vital cautions)
 * spoken after the answer.
 */
public class Decision {

    public final DecisionType type;
    public final Map<String, Object> patientParams;
    public final List<ScoredEntry> candidates;
    public final List<RecommendedAction> recommendations;
    public final boolean confident;
    public final List<String> notices;

    public Decision(DecisionType type, Map<String, Object> patientParams, List<ScoredEntry> candidates,
                    List<RecommendedAction> recommendations, boolean confident, List<String> notices) {
        this.type = type;
        this.patientParams = patientParams;
        this.candidates = List.copyOf(candidates);
        this.recommendations = List.copyOf(recommendations);
        this.confident = confident;
        this.notices = List.copyOf(notices);
    }

    public RecommendedAction primary() {
        return recommendations.isEmpty() ? null : recommendations.get(0);
    }

    @Override
    public String toString() {
        return String.format("Decision{type=%s, confident=%s, actions=%d, candidates=%d, notices=%s}",
            type, confident, recommendations.size(), candidates.size(), notices);
    }
}
