package com.recall.vitals;

import com.recall.policy.ClinicalPolicy.Phrases;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * VitalSignsAnalyzer - Classifies current vitals against the range table and
 * proposes stabilizing actions. Ranges are checked in policy order, so the first
 * concern reported is deterministic.
 */
public class VitalSignsAnalyzer {

    private static final String BP_SYSTOLIC = "bp_systolic";
    private static final String BP_DIASTOLIC = "bp_diastolic";

    private final List<VitalRangeSpec> ranges;
    private final List<VitalCaution> cautions;
    private final Phrases phrases;

    public VitalSignsAnalyzer(List<VitalRangeSpec> ranges, List<VitalCaution> cautions, Phrases phrases) {
        this.ranges = List.copyOf(ranges);
        this.cautions = List.copyOf(cautions);
        this.phrases = phrases;
    }

    public VitalAssessment analyze(Map<String, Double> vitals) {
        List<String> concerns = new ArrayList<>();
        List<String> criticalConcerns = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        for (VitalRangeSpec range : ranges) {
            Double value = vitals.get(range.vital);
            if (value == null) {
                continue;
            }
            if (range.isCritical(value)) {
                String concern = String.format("%s: %s (CRITICAL)", range.label, formatValue(value));
                concerns.add(concern);
                criticalConcerns.add(concern);
                String action = value < range.criticalLow ? range.lowAction : range.highAction;
                if (action != null) {
                    recommendations.add(action);
                }
            } else if (range.isAbnormal(value)) {
                concerns.add(String.format("%s: %s (abnormal)", range.label, formatValue(value)));
            }
        }

        String status = !criticalConcerns.isEmpty() ? VitalAssessment.CRITICAL
            : !concerns.isEmpty() ? VitalAssessment.ABNORMAL
            : VitalAssessment.NORMAL;
        return new VitalAssessment(status, concerns, criticalConcerns, recommendations);
    }

    /**
     * One-line guidance for the current vitals: the critical message when any vital
     * is critical, else a caution about the drug the query asks for, else the
     * all-clear.
     */
    public String treatmentRecommendation(Map<String, Double> vitals, String query) {
        VitalAssessment assessment = analyze(vitals);
        if (assessment.critical) {
            return criticalMessage(assessment);
        }
        return caution(vitals, query).orElse(phrases.vitalsAcceptable);
    }

    public String criticalMessage(VitalAssessment assessment) {
        String recommendation = assessment.recommendations.isEmpty()
            ? phrases.stabilizeFirst
            : assessment.recommendations.get(0);
        return "CRITICAL: " + assessment.criticalConcerns.get(0) + ". " + recommendation;
    }

    public Optional<String> caution(Map<String, Double> vitals, String query) {
        for (VitalCaution caution : cautions) {
            if (caution.appliesTo(vitals, query)) {
                return Optional.of(caution.message);
            }
        }
        return Optional.empty();
    }

    /** "BP: 120/80, HR: 88, SpO2: 97%, RR: 16, Temp: 37°C" or the no-vitals phrase. */
    public String summarize(Map<String, Double> vitals) {
        if (vitals.isEmpty()) {
            return phrases.noVitalsSummary;
        }
        List<String> parts = new ArrayList<>();
        if (vitals.containsKey(BP_SYSTOLIC) && vitals.containsKey(BP_DIASTOLIC)) {
            parts.add("BP: " + formatValue(vitals.get(BP_SYSTOLIC)) + "/" + formatValue(vitals.get(BP_DIASTOLIC)));
        }
        for (VitalRangeSpec range : ranges) {
            if (range.vital.equals(BP_SYSTOLIC) || range.vital.equals(BP_DIASTOLIC)) {
                continue;
            }
            Double value = vitals.get(range.vital);
            if (value != null) {
                parts.add(range.label + ": " + formatValue(value) + range.unit);
            }
        }
        return String.join(", ", parts) + ".";
    }

    static String formatValue(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
