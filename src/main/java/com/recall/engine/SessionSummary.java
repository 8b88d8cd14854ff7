package com.recall.engine;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * SessionSummary - Patient state and recent turns of a session, for hand-off notes.
 */
public class SessionSummary {

    public final String sessionId;
    public final Map<String, Object> patient;
    public final String vitals;
    public final List<TurnRecord> recentTurns;
    public final int totalTurns;

    public SessionSummary(String sessionId, Map<String, Object> patient, String vitals,
                          List<TurnRecord> recentTurns, int totalTurns) {
        this.sessionId = sessionId;
        this.patient = patient;
        this.vitals = vitals;
        this.recentTurns = List.copyOf(recentTurns);
        this.totalTurns = totalTurns;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Session ").append(sessionId).append(" (").append(totalTurns).append(" turns)\n");
        Object weight = patient.get("weight_kg");
        sb.append("  Weight: ").append(weight == null ? "unknown" : String.format(Locale.ROOT, "%.1f kg", (Double) weight)).append('\n');
        sb.append("  Allergies: ").append(patient.get("allergies")).append('\n');
        sb.append("  Conditions: ").append(patient.get("conditions")).append('\n');
        sb.append("  Critical: ").append(patient.get("critical_patient")).append('\n');
        sb.append("  Vitals: ").append(vitals).append('\n');
        for (TurnRecord turn : recentTurns) {
            sb.append("  ").append(turn).append('\n');
        }
        return sb.toString();
    }
}
