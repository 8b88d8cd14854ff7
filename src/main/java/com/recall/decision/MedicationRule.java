package com.recall.decision;

import com.recall.query.TermMatcher;

import java.util.List;

/**
 * MedicationRule - Trigger words for one medication and its dose rules by intent.
 */
public class MedicationRule {

    public final String name;
    public final List<String> triggers;
    public final List<DoseRule> doses;

    public MedicationRule(String name, List<String> triggers, List<DoseRule> doses) {
        this.name = name;
        this.triggers = List.copyOf(triggers);
        this.doses = List.copyOf(doses);
    }

    public boolean matches(String query) {
        return TermMatcher.containsAny(query, triggers);
    }

    /** First intent whose keywords appear, else the default intent. */
    public DoseRule selectDose(String query) {
        DoseRule fallback = null;
        for (DoseRule dose : doses) {
            if (dose.isDefault()) {
                if (fallback == null) {
                    fallback = dose;
                }
            } else if (dose.matches(query)) {
                return dose;
            }
        }
        return fallback != null ? fallback : doses.get(0);
    }
}
