package com.recall.patient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.recall.query.QueryNormalizer;
import com.recall.support.MutableClock;
import com.recall.support.TestEngines;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PatientContextUpdaterTest {

    private MutableClock clock;
    private QueryNormalizer normalizer;
    private PatientContextUpdater updater;
    private PatientContext context;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestEngines.START);
        normalizer = TestEngines.normalizer();
        updater = new PatientContextUpdater(TestEngines.POLICY.patient, clock);
        context = new PatientContext();
    }

    private ContextUpdate say(String utterance) {
        return updater.update(context, normalizer.clean(utterance));
    }

    @Test
    void poundsAreConvertedToKilograms() {
        ContextUpdate update = say("patient weighs 154 pounds");

        assertTrue(update.changed());
        assertEquals(69.9, context.weightKg().orElseThrow(), 0.05);
    }

    @Test
    void kilogramWeightIsRecordedAndLastValueWins() {
        say("patient is 80 kilograms");
        assertEquals(80.0, context.weightKg().orElseThrow());

        say("sorry 90 kg not 80 kg, make that 85 kg");
        assertEquals(85.0, context.weightKg().orElseThrow());
    }

    @Test
    void allergiesNeedAnAllergyCue() {
        assertFalse(say("penicillin").changed());
        assertTrue(context.allergies().isEmpty());

        ContextUpdate update = say("patient is allergic to penicillin and latex");
        assertEquals(List.of("penicillin", "latex"), update.allergiesAdded);

        assertFalse(say("allergic to penicillin").changed());
    }

    @Test
    void conditionsMatchWholeWordsOnly() {
        assertFalse(say("patient was admitted yesterday").changed());
        assertTrue(context.conditions().isEmpty());

        say("she is pregnant with high blood pressure");
        assertEquals(Set.of("pregnancy", "hypertension"), context.conditions());
    }

    @Test
    void vitalsUpdateMapHistoryAndLastCheck() {
        ContextUpdate update = say("bp 120/80 heart rate 88 sats 97 rr 16 temp 37.2");

        assertEquals(6, update.vitalsRecorded.size());
        assertEquals(120.0, context.vitals().get("bp_systolic"));
        assertEquals(80.0, context.vitals().get("bp_diastolic"));
        assertEquals(88.0, context.vitals().get("hr"));
        assertEquals(97.0, context.vitals().get("spo2"));
        assertEquals(16.0, context.vitals().get("rr"));
        assertEquals(37.2, context.vitals().get("temp"));
        assertEquals(TestEngines.START, context.lastVitalCheck().orElseThrow());
    }

    @Test
    void repeatedVitalAppendsHistoryAndKeepsLatestValue() {
        say("hr 110");
        clock.advance(Duration.ofMinutes(3));
        say("pulse is 96");

        assertEquals(96.0, context.vitals().get("hr"));
        assertEquals(2, context.vitalHistory().size());
        assertEquals(110.0, context.vitalHistory().get(0).value);
        assertEquals(TestEngines.START.plus(Duration.ofMinutes(3)), context.lastVitalCheck().orElseThrow());
    }

    @Test
    void criticalFlagNeedsExplicitUnnegatedCue() {
        assertFalse(say("patient is not critical").criticalMarked);
        assertFalse(context.isCritical());

        assertTrue(say("patient is unstable").criticalMarked);
        assertTrue(context.isCritical());
        assertFalse(say("patient is critical").criticalMarked);
    }

    @Test
    void injuryDescribedAsCriticalDoesNotMarkThePatient() {
        assertFalse(say("critical bleeding from the thigh").criticalMarked);
        assertFalse(say("unstable pelvis after the fall").criticalMarked);
        assertFalse(context.isCritical());

        assertTrue(say("casualty is critical").criticalMarked);
    }

    @Test
    void criticalFlagIsNotInferredFromVitals() {
        say("hr 35");

        assertFalse(context.isCritical());
    }

    @Test
    void plainClinicalQuestionChangesNothing() {
        ContextUpdate update = say("ketamine for pain");

        assertFalse(update.changed());
        assertTrue(context.vitals().isEmpty());
        assertTrue(context.weightKg().isEmpty());
    }
}
