package com.recall.vitals;

import java.util.List;

/**
 * VitalAssessment - Result of classifying the current vitals.
 * Status is one of "normal", "abnormal" or "critical".
 */
public class VitalAssessment {

    public static final String NORMAL = "normal";
    public static final String ABNORMAL = "abnormal";
    public static final String CRITICAL = "critical";

    public final String status;
    public final List<String> concerns;
    public final List<String> criticalConcerns;
    public final List<String> recommendations;
    public final boolean critical;

    public VitalAssessment(String status, List<String> concerns, List<String> criticalConcerns,
                           List<String> recommendations) {
        this.status = status;
        this.concerns = List.copyOf(concerns);
        this.criticalConcerns = List.copyOf(criticalConcerns);
        this.recommendations = List.copyOf(recommendations);
        this.critical = !criticalConcerns.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("VitalAssessment{status=%s, concerns=%s, recommendations=%s}",
            status, concerns, recommendations);
    }
}
