package com.recall.decision;

/**
 * RecommendedAction - One speakable action point. Medication actions carry the
 * medication and dose so the formatter can drop repeats of the same fact.
 */
public class RecommendedAction {

    public final String text;
    public final String medication;   // null for non-medication actions
    public final String dose;         // null when no dose was computed
    public final int priority;
    public final String source;

    public RecommendedAction(String text, String medication, String dose, int priority, String source) {
        this.text = text;
        this.medication = medication;
        this.dose = dose;
        this.priority = priority;
        this.source = source == null ? "" : source;
    }

    public static RecommendedAction of(String text, int priority) {
        return new RecommendedAction(text, null, null, priority, "");
    }

    public String dedupKey() {
        if (medication != null && dose != null) {
            return medication + "|" + dose;
        }
        return text.toLowerCase().replaceAll("[^a-z0-9]+", " ").trim();
    }

    @Override
    public String toString() {
        return String.format("RecommendedAction{text='%s', medication=%s, dose=%s, priority=%d}",
            text, medication, dose, priority);
    }
}
