package com.recall.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.recall.engine.RecallEngineFactory.Components;
import com.recall.messages.Messages.*;
import com.recall.speech.SpeechSynthesizer;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * ConsultationManagerActor - One child actor per session id, created on the
 * first utterance. Turns are FORWARDed to the child; the built engine is shared
 * read-only across all of them.
 */
public class ConsultationManagerActor extends AbstractBehavior<ConsultationCommand> {

    private final Components components;
    private final int historySize;
    private final Supplier<SpeechSynthesizer> synthesizers;
    private final ActorRef<LogCommand> logger;
    private final Map<String, ActorRef<ConsultationCommand>> sessions = new HashMap<>();
    private long spawned = 0;

    public static Behavior<ConsultationCommand> create(Components components, int historySize,
                                                       Supplier<SpeechSynthesizer> synthesizers) {
        return Behaviors.setup(context -> new ConsultationManagerActor(context, components, historySize,
            synthesizers, context.spawn(LoggerActor.create(), "logger")));
    }

    public static Behavior<ConsultationCommand> create(Components components, int historySize,
                                                       Supplier<SpeechSynthesizer> synthesizers,
                                                       ActorRef<LogCommand> logger) {
        return Behaviors.setup(context -> new ConsultationManagerActor(context, components, historySize,
            synthesizers, logger));
    }

    private ConsultationManagerActor(ActorContext<ConsultationCommand> context, Components components,
                                     int historySize, Supplier<SpeechSynthesizer> synthesizers,
                                     ActorRef<LogCommand> logger) {
        super(context);
        this.components = components;
        this.historySize = historySize;
        this.synthesizers = synthesizers;
        this.logger = logger;
        getContext().getLog().info("👥 Consultation manager ready");
    }

    @Override
    public Receive<ConsultationCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(HandleUtterance.class, this::onHandleUtterance)
                .onMessage(GetSummary.class, this::onGetSummary)
                .onMessage(EndSession.class, this::onEndSession)
                .onMessage(SessionTerminated.class, this::onSessionTerminated)
                .build();
    }

    private Behavior<ConsultationCommand> onHandleUtterance(HandleUtterance msg) {
        sessionFor(msg.sessionId).tell(msg);
        return this;
    }

    private Behavior<ConsultationCommand> onGetSummary(GetSummary msg) {
        ActorRef<ConsultationCommand> session = sessions.get(msg.sessionId);
        if (session == null) {
            msg.replyTo.tell(new SummaryReply(msg.sessionId, null));
        } else {
            session.tell(msg);
        }
        return this;
    }

    private Behavior<ConsultationCommand> onEndSession(EndSession msg) {
        ActorRef<ConsultationCommand> session = sessions.get(msg.sessionId);
        if (session != null) {
            sessions.remove(msg.sessionId);
            getContext().stop(session);
            logger.tell(new LogEvent(msg.sessionId, "ConsultationManagerActor", "Session ended", "INFO"));
        }
        return this;
    }

    private Behavior<ConsultationCommand> onSessionTerminated(SessionTerminated msg) {
        sessions.remove(msg.sessionId, msg.session);
        return this;
    }

    private ActorRef<ConsultationCommand> sessionFor(String sessionId) {
        ActorRef<ConsultationCommand> existing = sessions.get(sessionId);
        if (existing != null) {
            return existing;
        }
        ActorRef<ConsultationCommand> child = getContext().spawn(
            ConsultationSessionActor.create(components.newSession(sessionId, historySize),
                synthesizers.get(), logger),
            "session-" + URLEncoder.encode(sessionId, StandardCharsets.UTF_8) + "-" + (++spawned));
        getContext().watchWith(child, new SessionTerminated(sessionId, child));
        sessions.put(sessionId, child);
        logger.tell(new LogEvent(sessionId, "ConsultationManagerActor",
            "New session, active sessions: " + sessions.size(), "INFO"));
        return child;
    }
}
