package com.recall.patient;

import java.util.List;

/**
 * ContextUpdate - What one utterance changed in the patient context.
 */
public class ContextUpdate {

    public final Double weightKg;                 // null when no weight was stated
    public final List<String> allergiesAdded;
    public final List<String> conditionsAdded;
    public final List<VitalReading> vitalsRecorded;
    public final boolean criticalMarked;

    public ContextUpdate(Double weightKg, List<String> allergiesAdded, List<String> conditionsAdded,
                         List<VitalReading> vitalsRecorded, boolean criticalMarked) {
        this.weightKg = weightKg;
        this.allergiesAdded = List.copyOf(allergiesAdded);
        this.conditionsAdded = List.copyOf(conditionsAdded);
        this.vitalsRecorded = List.copyOf(vitalsRecorded);
        this.criticalMarked = criticalMarked;
    }

    public static ContextUpdate none() {
        return new ContextUpdate(null, List.of(), List.of(), List.of(), false);
    }

    public boolean changed() {
        return weightKg != null
            || !allergiesAdded.isEmpty()
            || !conditionsAdded.isEmpty()
            || !vitalsRecorded.isEmpty()
            || criticalMarked;
    }

    @Override
    public String toString() {
        return String.format("ContextUpdate{weight=%s, allergies=%s, conditions=%s, vitals=%d, critical=%s}",
            weightKg, allergiesAdded, conditionsAdded, vitalsRecorded.size(), criticalMarked);
    }
}
