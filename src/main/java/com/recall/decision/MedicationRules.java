package com.recall.decision;

import java.util.ArrayList;
import java.util.List;

/**
 * MedicationRules - Direct dose answers, one action per medication named in the
 * query, in table order.
 */
public class MedicationRules {

    private final List<MedicationRule> rules;

    public MedicationRules(List<MedicationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean mentionsMedication(String query) {
        return rules.stream().anyMatch(r -> r.matches(query));
    }

    public List<RecommendedAction> resolve(String query, Double weightKg) {
        List<RecommendedAction> actions = new ArrayList<>();
        for (MedicationRule rule : rules) {
            if (!rule.matches(query)) {
                continue;
            }
            DoseRule dose = rule.selectDose(query);
            String doseText = dose.isWeightBased() && weightKg != null
                ? dose.computeDose(weightKg) + dose.unit
                : null;
            actions.add(new RecommendedAction(dose.render(weightKg), rule.name, doseText, 5, "dose-table"));
        }
        return actions;
    }
}
