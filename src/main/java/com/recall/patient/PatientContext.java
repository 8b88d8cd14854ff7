package com.recall.patient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PatientContext - Per-session patient state built up across turns.
 *
 * <p>Not thread-safe: each session owns exactly one instance and mutates it only
 * from its own turn loop. The vitals map holds the latest value per vital; the
 * history only ever grows.
 */
public class PatientContext {

    private Double weightKg;
    private final Set<String> allergies = new LinkedHashSet<>();
    private final Set<String> conditions = new LinkedHashSet<>();
    private final Map<String, Double> vitals = new LinkedHashMap<>();
    private final List<VitalReading> vitalHistory = new ArrayList<>();
    private boolean criticalPatient;
    private Instant lastVitalCheck;

    public Optional<Double> weightKg() {
        return Optional.ofNullable(weightKg);
    }

    public void recordWeight(double kg) {
        this.weightKg = kg;
    }

    public boolean addAllergy(String allergen) {
        return allergies.add(allergen);
    }

    public boolean addCondition(String condition) {
        return conditions.add(condition);
    }

    public void recordVital(String vital, double value, Instant at) {
        vitals.put(vital, value);
        vitalHistory.add(new VitalReading(at, vital, value));
        lastVitalCheck = at;
    }

    public boolean markCritical() {
        if (criticalPatient) {
            return false;
        }
        criticalPatient = true;
        return true;
    }

    public Set<String> allergies() {
        return Collections.unmodifiableSet(allergies);
    }

    public Set<String> conditions() {
        return Collections.unmodifiableSet(conditions);
    }

    public Map<String, Double> vitals() {
        return Collections.unmodifiableMap(vitals);
    }

    public List<VitalReading> vitalHistory() {
        return Collections.unmodifiableList(vitalHistory);
    }

    public boolean isCritical() {
        return criticalPatient;
    }

    public Optional<Instant> lastVitalCheck() {
        return Optional.ofNullable(lastVitalCheck);
    }

    /** Plain snapshot of the current state, for decisions and hand-off summaries. */
    public Map<String, Object> snapshot() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("weight_kg", weightKg);
        params.put("allergies", List.copyOf(allergies));
        params.put("conditions", List.copyOf(conditions));
        params.put("vitals", Map.copyOf(vitals));
        params.put("critical_patient", criticalPatient);
        params.put("last_vital_check", lastVitalCheck);
        return params;
    }

    @Override
    public String toString() {
        return String.format("PatientContext{weight=%s, allergies=%s, conditions=%s, vitals=%s, critical=%s}",
            weightKg, allergies, conditions, vitals, criticalPatient);
    }
}
