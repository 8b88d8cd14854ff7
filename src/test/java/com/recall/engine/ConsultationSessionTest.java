package com.recall.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.recall.support.MutableClock;
import com.recall.support.TestEngines;
import org.junit.jupiter.api.Test;

class ConsultationSessionTest {

    private final MutableClock clock = new MutableClock(TestEngines.START);

    @Test
    void historyKeepsOnlyMostRecentTurns() {
        ConsultationSession session = TestEngines.components(clock).newSession("s1", 3);

        for (int i = 0; i < 5; i++) {
            session.handle("turn " + i);
        }

        SessionSummary summary = session.summary();
        assertEquals(5, summary.totalTurns);
        assertEquals(3, summary.recentTurns.size());
        assertEquals("turn 2", summary.recentTurns.get(0).utterance);
    }

    @Test
    void summaryDescribesPatientState() {
        ConsultationSession session = TestEngines.components(clock).newSession("s2", 10);
        session.handle("patient is 80 kg, allergic to latex");
        session.handle("heart rate 88");

        SessionSummary summary = session.summary();
        String description = summary.describe();

        assertEquals("HR: 88.", summary.vitals);
        assertTrue(description.contains("Weight: 80.0 kg"));
        assertTrue(description.contains("[latex]"));
        assertTrue(description.contains("Session s2 (2 turns)"));
    }

    @Test
    void sessionsDoNotShareContext() {
        RecallEngineFactory.Components components = TestEngines.components(clock);
        ConsultationSession first = components.newSession("a", 10);
        ConsultationSession second = components.newSession("b", 10);

        first.handle("patient is 80 kg");
        TurnResponse response = second.handle("ketamine for pain");

        assertTrue(second.context().weightKg().isEmpty());
        assertTrue(response.answer.startsWith("Ketamine 0.3 mg/kg IV for pain."));
    }
}
