package com.recall.vitals;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.recall.support.TestEngines;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VitalSignsAnalyzerTest {

    private VitalSignsAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = TestEngines.analyzer();
    }

    @Test
    void normalVitalsRaiseNoConcern() {
        VitalAssessment assessment = analyzer.analyze(Map.of("hr", 80.0, "spo2", 98.0, "rr", 14.0));

        assertEquals(VitalAssessment.NORMAL, assessment.status);
        assertTrue(assessment.concerns.isEmpty());
        assertFalse(assessment.critical);
    }

    @Test
    void bradycardiaBelowCriticalLowSuggestsAtropine() {
        Map<String, Double> vitals = Map.of("hr", 40.0);

        VitalAssessment assessment = analyzer.analyze(vitals);
        assertTrue(assessment.critical);
        assertEquals(List.of("HR: 40 (CRITICAL)"), assessment.concerns);

        assertEquals("CRITICAL: HR: 40 (CRITICAL). Consider atropine 1mg IV for bradycardia",
            analyzer.treatmentRecommendation(vitals, "ketamine for pain"));
    }

    @Test
    void outOfNormalButInsideCriticalIsAbnormalOnly() {
        VitalAssessment assessment = analyzer.analyze(Map.of("hr", 110.0));

        assertEquals(VitalAssessment.ABNORMAL, assessment.status);
        assertEquals(List.of("HR: 110 (abnormal)"), assessment.concerns);
        assertTrue(assessment.recommendations.isEmpty());
    }

    @Test
    void criticalVitalWithoutActionFallsBackToStabilize() {
        assertEquals("CRITICAL: RR: 35 (CRITICAL). Stabilize patient first.",
            analyzer.treatmentRecommendation(Map.of("rr", 35.0), "anything"));
    }

    @Test
    void firstCriticalConcernIsReportedNotFirstAbnormal() {
        Map<String, Double> vitals = new LinkedHashMap<>();
        vitals.put("spo2", 85.0);
        vitals.put("hr", 105.0);

        assertEquals("CRITICAL: SpO2: 85 (CRITICAL). Administer oxygen, consider airway intervention",
            analyzer.treatmentRecommendation(vitals, ""));
    }

    @Test
    void lowSaturationCautionsAgainstOpioids() {
        Map<String, Double> vitals = Map.of("spo2", 93.0);

        assertEquals("Low oxygen saturation. Monitor respiratory depression closely.",
            analyzer.treatmentRecommendation(vitals, "morphine for pain"));
        assertEquals("Vitals acceptable. Proceed with treatment.",
            analyzer.treatmentRecommendation(vitals, "txa"));
    }

    @Test
    void summaryListsVitalsInClinicalOrder() {
        Map<String, Double> vitals = new LinkedHashMap<>();
        vitals.put("temp", 37.2);
        vitals.put("hr", 88.0);
        vitals.put("bp_systolic", 120.0);
        vitals.put("bp_diastolic", 80.0);
        vitals.put("spo2", 97.0);

        assertEquals("BP: 120/80, HR: 88, SpO2: 97%, Temp: 37.2°C.", analyzer.summarize(vitals));
        assertEquals("No vitals recorded.", analyzer.summarize(Map.of()));
    }
}
