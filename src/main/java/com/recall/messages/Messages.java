package com.recall.messages;

import akka.actor.typed.ActorRef;
import com.recall.engine.SessionSummary;
import com.recall.engine.TurnResponse;

import java.time.Instant;
import java.util.List;

/**
 * Centralized message definitions for the consultation actors.
 * Turns and summaries use ASK, logging uses TELL, the manager FORWARDs to sessions.
 */
public class Messages {

    // ========== CONSULTATION MESSAGES ==========
    public interface ConsultationCommand {}

    public static class HandleUtterance implements ConsultationCommand {
        public final String sessionId;
        public final String utterance;
        public final ActorRef<TurnReply> replyTo;
        public final Instant timestamp;

        public HandleUtterance(String sessionId, String utterance, ActorRef<TurnReply> replyTo) {
            this.sessionId = sessionId;
            this.utterance = utterance;
            this.replyTo = replyTo;
            this.timestamp = Instant.now();
        }
    }

    public static class TurnReply {
        public final String sessionId;
        public final String answer;
        public final List<String> advisories;
        public final String spokenText;
        public final boolean failed;

        public TurnReply(String sessionId, TurnResponse response) {
            this.sessionId = sessionId;
            this.answer = response.answer;
            this.advisories = response.advisories;
            this.spokenText = response.spokenText;
            this.failed = response.failed;
        }
    }

    public static class GetSummary implements ConsultationCommand {
        public final String sessionId;
        public final ActorRef<SummaryReply> replyTo;

        public GetSummary(String sessionId, ActorRef<SummaryReply> replyTo) {
            this.sessionId = sessionId;
            this.replyTo = replyTo;
        }
    }

    public static class SummaryReply {
        public final String sessionId;
        public final SessionSummary summary;    // null when the session is unknown
        public final boolean found;

        public SummaryReply(String sessionId, SessionSummary summary) {
            this.sessionId = sessionId;
            this.summary = summary;
            this.found = summary != null;
        }
    }

    public static class EndSession implements ConsultationCommand {
        public final String sessionId;

        public EndSession(String sessionId) {
            this.sessionId = sessionId;
        }
    }

    /** Sent to the manager when a session actor stops. */
    public static class SessionTerminated implements ConsultationCommand {
        public final String sessionId;
        public final ActorRef<ConsultationCommand> session;

        public SessionTerminated(String sessionId, ActorRef<ConsultationCommand> session) {
            this.sessionId = sessionId;
            this.session = session;
        }
    }

    // ========== LOGGING MESSAGES ==========
    public interface LogCommand {}

    public static class LogEvent implements LogCommand {
        public final String sessionId;
        public final String actorName;
        public final String event;
        public final String level;
        public final Instant timestamp;

        public LogEvent(String sessionId, String actorName, String event, String level) {
            this.sessionId = sessionId;
            this.actorName = actorName;
            this.event = event;
            this.level = level;
            this.timestamp = Instant.now();
        }
    }

    /** Closes the audit tally of a session; sent once when its actor stops. */
    public static class CloseAudit implements LogCommand {
        public final String sessionId;

        public CloseAudit(String sessionId) {
            this.sessionId = sessionId;
        }
    }
}
