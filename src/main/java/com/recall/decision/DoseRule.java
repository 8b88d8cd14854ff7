package com.recall.decision;

import com.recall.query.TermMatcher;

import java.util.List;

/**
 * DoseRule - Dosing for one medication intent (pain, sedation, arrest, ...).
 *
 * <p>When {@code ratePerKg} is set and the weight is known the dose is
 * {@code round(ratePerKg * weightKg)}; otherwise the population text is spoken.
 * An intent without keywords is the medication's default.
 */
public class DoseRule {

    public final String intent;
    public final List<String> keywords;
    public final Double ratePerKg;     // null for fixed doses
    public final String unit;
    public final String route;
    public final String rateText;      // null for fixed doses
    public final String doseNote;
    public final String populationText;

    public DoseRule(String intent, List<String> keywords, Double ratePerKg, String unit, String route,
                    String rateText, String doseNote, String populationText) {
        this.intent = intent;
        this.keywords = List.copyOf(keywords);
        this.ratePerKg = ratePerKg;
        this.unit = unit;
        this.route = route;
        this.rateText = rateText;
        this.doseNote = doseNote == null ? "" : doseNote;
        this.populationText = populationText;
    }

    public boolean isDefault() {
        return keywords.isEmpty();
    }

    public boolean matches(String query) {
        return TermMatcher.containsAny(query, keywords);
    }

    public boolean isWeightBased() {
        return ratePerKg != null && rateText != null;
    }

    public long computeDose(double weightKg) {
        return Math.round(ratePerKg * weightKg);
    }

    public String render(Double weightKg) {
        if (!isWeightBased() || weightKg == null) {
            return populationText;
        }
        return String.format("%s. For %dkg patient: %d%s %s%s.",
            rateText, Math.round(weightKg), computeDose(weightKg), unit, route, doseNote);
    }
}
