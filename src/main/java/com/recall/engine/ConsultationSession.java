package com.recall.engine;

import com.recall.patient.PatientContext;
import com.recall.vitals.VitalSignsAnalyzer;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * ConsultationSession - One conversation: its own patient context and a bounded
 * in-memory history of turns. Single-writer; the owning actor serializes access.
 */
public class ConsultationSession {

    private final String sessionId;
    private final RecallEngine engine;
    private final VitalSignsAnalyzer analyzer;
    private final PatientContext context = new PatientContext();
    private final Deque<TurnRecord> history = new ArrayDeque<>();
    private final int historySize;
    private final Clock clock;
    private int totalTurns;

    public ConsultationSession(String sessionId, RecallEngine engine, VitalSignsAnalyzer analyzer,
                               int historySize, Clock clock) {
        this.sessionId = sessionId;
        this.engine = engine;
        this.analyzer = analyzer;
        this.historySize = Math.max(1, historySize);
        this.clock = clock;
    }

    public TurnResponse handle(String utterance) {
        TurnResponse response = engine.handleTurn(sessionId, context, utterance);
        history.addLast(new TurnRecord(clock.instant(), utterance, response.spokenText));
        while (history.size() > historySize) {
            history.removeFirst();
        }
        totalTurns++;
        return response;
    }

    public SessionSummary summary() {
        return new SessionSummary(sessionId, context.snapshot(), analyzer.summarize(context.vitals()),
            new ArrayList<>(history), totalTurns);
    }

    public String sessionId() {
        return sessionId;
    }

    public PatientContext context() {
        return context;
    }
}
