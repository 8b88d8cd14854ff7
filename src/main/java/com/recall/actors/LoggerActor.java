package com.recall.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.recall.messages.Messages.*;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * LoggerActor - Audit trail shared by all consultation sessions.
 * Receives fire-and-forget LogEvent messages (TELL) and keeps a per-session
 * tally by level, reported once when the session closes.
 */
public class LoggerActor extends AbstractBehavior<LogCommand> {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final Map<String, Map<String, Integer>> tallies = new HashMap<>();

    public static Behavior<LogCommand> create() {
        return Behaviors.setup(LoggerActor::new);
    }

    private LoggerActor(ActorContext<LogCommand> context) {
        super(context);
        getContext().getLog().info("📝 Audit logger ready");
    }

    @Override
    public Receive<LogCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LogEvent.class, this::onLogEvent)
                .onMessage(CloseAudit.class, this::onCloseAudit)
                .build();
    }

    private Behavior<LogCommand> onLogEvent(LogEvent msg) {
        String level = msg.level.toUpperCase();
        tallies.computeIfAbsent(msg.sessionId, id -> new TreeMap<>()).merge(level, 1, Integer::sum);

        String line = String.format("[%s] %s %s | Session: %s | %s: %s",
            msg.timestamp.atZone(ZoneId.systemDefault()).format(TIME_FORMAT),
            emojiFor(level), level, msg.sessionId, msg.actorName, msg.event);
        switch (level) {
            case "CRITICAL":
                getContext().getLog().error("🚨 CRITICAL: {}", line);
                break;
            case "ERROR":
                getContext().getLog().error(line);
                break;
            case "WARNING":
                getContext().getLog().warn(line);
                break;
            case "DEBUG":
                getContext().getLog().debug(line);
                break;
            default:
                getContext().getLog().info(line);
        }
        return this;
    }

    private Behavior<LogCommand> onCloseAudit(CloseAudit msg) {
        Map<String, Integer> tally = tallies.remove(msg.sessionId);
        if (tally == null) {
            return this;
        }
        int total = tally.values().stream().mapToInt(Integer::intValue).sum();
        getContext().getLog().info("📋 Audit closed for session {}: {} events {}", msg.sessionId, total, tally);
        return this;
    }

    private String emojiFor(String level) {
        switch (level) {
            case "CRITICAL":
                return "🚨";
            case "ERROR":
                return "❌";
            case "WARNING":
                return "⚠️";
            case "DEBUG":
                return "🔍";
            default:
                return "🩺";
        }
    }
}
