package com.recall.vitals;

import com.recall.query.TermMatcher;

import java.util.List;
import java.util.Map;

/**
 * VitalCaution - A non-critical vital reading that argues against a drug the
 * query asks about (tachycardia and epinephrine, for example).
 */
public class VitalCaution {

    public final String vital;
    public final Double above;    // null when unbounded
    public final Double below;    // null when unbounded
    public final List<String> triggers;
    public final String message;

    public VitalCaution(String vital, Double above, Double below, List<String> triggers, String message) {
        this.vital = vital;
        this.above = above;
        this.below = below;
        this.triggers = List.copyOf(triggers);
        this.message = message;
    }

    public boolean appliesTo(Map<String, Double> vitals, String query) {
        Double value = vitals.get(vital);
        if (value == null) {
            return false;
        }
        boolean outOfBounds = (above != null && value > above) || (below != null && value < below);
        return outOfBounds && TermMatcher.containsAny(query, triggers);
    }
}
