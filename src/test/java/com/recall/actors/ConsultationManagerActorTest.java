package com.recall.actors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.recall.messages.Messages.*;
import com.recall.speech.SpeechSynthesizer;
import com.recall.support.MutableClock;
import com.recall.support.TestEngines;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsultationManagerActorTest {

    private static ActorTestKit testKit;

    private SpeechSynthesizer synthesizer;
    private ActorRef<ConsultationCommand> manager;
    private TestProbe<TurnReply> turns;
    private TestProbe<SummaryReply> summaries;

    @BeforeAll
    static void startKit() {
        testKit = ActorTestKit.create();
    }

    @AfterAll
    static void stopKit() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    void setUp() {
        synthesizer = mock(SpeechSynthesizer.class);
        when(synthesizer.name()).thenReturn("test-voice");
        manager = testKit.spawn(ConsultationManagerActor.create(
            TestEngines.components(new MutableClock(TestEngines.START)), 10, () -> synthesizer));
        turns = testKit.createTestProbe(TurnReply.class);
        summaries = testKit.createTestProbe(SummaryReply.class);
    }

    private TurnReply say(String sessionId, String utterance) {
        manager.tell(new HandleUtterance(sessionId, utterance, turns.getRef()));
        return turns.receiveMessage();
    }

    @Test
    void eachSessionKeepsItsOwnPatient() {
        say("alpha", "patient is 80 kg");

        TurnReply alpha = say("alpha", "ketamine for pain");
        TurnReply bravo = say("bravo", "ketamine for pain");

        assertEquals("alpha", alpha.sessionId);
        assertEquals("Ketamine 0.3 mg/kg IV. For 80kg patient: 24mg IV.", alpha.answer);
        assertEquals("Ketamine 0.3 mg/kg IV for pain. Monitor respiratory rate.", bravo.answer);
    }

    @Test
    void spokenTextGoesToTheSynthesizer() {
        TurnReply reply = say("charlie", "airway");

        verify(synthesizer, timeout(1000)).speak("charlie", reply.spokenText);
    }

    @Test
    void summaryReflectsSessionState() {
        say("delta", "patient is 70 kg, allergic to latex");

        manager.tell(new GetSummary("delta", summaries.getRef()));
        SummaryReply reply = summaries.receiveMessage();

        assertTrue(reply.found);
        assertEquals(70.0, reply.summary.patient.get("weight_kg"));
        assertEquals(1, reply.summary.totalTurns);
    }

    @Test
    void unknownSessionHasNoSummary() {
        manager.tell(new GetSummary("nobody", summaries.getRef()));

        assertFalse(summaries.receiveMessage().found);
    }

    @Test
    void endedSessionStartsOverWithEmptyContext() {
        say("echo", "patient is 80 kg");
        manager.tell(new EndSession("echo"));

        manager.tell(new GetSummary("echo", summaries.getRef()));
        assertFalse(summaries.receiveMessage().found);

        TurnReply reply = say("echo", "ketamine for pain");
        assertEquals("Ketamine 0.3 mg/kg IV for pain. Monitor respiratory rate.", reply.answer);
    }

    @Test
    void sessionIdsNeedNoEscaping() {
        TurnReply reply = say("unit 7/bay 2", "patient is 60 kg");

        assertEquals("unit 7/bay 2", reply.sessionId);
        assertFalse(reply.failed);
    }
}
