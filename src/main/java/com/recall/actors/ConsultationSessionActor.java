package com.recall.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.recall.engine.ConsultationSession;
import com.recall.engine.TurnResponse;
import com.recall.messages.Messages.*;
import com.recall.speech.SpeechSynthesizer;

import java.time.Duration;
import java.time.Instant;

/**
 * ConsultationSessionActor - Owns one ConsultationSession (patient context plus
 * turn history). The mailbox serializes turns, so the context has a single writer.
 */
public class ConsultationSessionActor extends AbstractBehavior<ConsultationCommand> {

    private final ConsultationSession session;
    private final SpeechSynthesizer synthesizer;
    private final ActorRef<LogCommand> logger;

    public static Behavior<ConsultationCommand> create(ConsultationSession session, SpeechSynthesizer synthesizer,
                                                       ActorRef<LogCommand> logger) {
        return Behaviors.setup(context -> new ConsultationSessionActor(context, session, synthesizer, logger));
    }

    private ConsultationSessionActor(ActorContext<ConsultationCommand> context, ConsultationSession session,
                                     SpeechSynthesizer synthesizer, ActorRef<LogCommand> logger) {
        super(context);
        this.session = session;
        this.synthesizer = synthesizer;
        this.logger = logger;
        getContext().getLog().debug("🩺 Session [{}] started with voice '{}'", session.sessionId(), synthesizer.name());
    }

    @Override
    public Receive<ConsultationCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(HandleUtterance.class, this::onHandleUtterance)
                .onMessage(GetSummary.class, this::onGetSummary)
                .onSignal(PostStop.class, signal -> onPostStop())
                .build();
    }

    private Behavior<ConsultationCommand> onHandleUtterance(HandleUtterance msg) {
        TurnResponse response = session.handle(msg.utterance);

        String level = response.failed ? "ERROR"
            : response.answer.startsWith("CRITICAL:") ? "CRITICAL"
            : "INFO";
        long elapsedMs = Duration.between(msg.timestamp, Instant.now()).toMillis();
        logger.tell(new LogEvent(msg.sessionId, "ConsultationSessionActor",
            "Turn answered in " + elapsedMs + "ms: " + response.answer, level));
        if (!response.advisories.isEmpty()) {
            logger.tell(new LogEvent(msg.sessionId, "ConsultationSessionActor",
                "Advisories: " + String.join(" | ", response.advisories), "WARNING"));
        }

        synthesizer.speak(msg.sessionId, response.spokenText);
        msg.replyTo.tell(new TurnReply(msg.sessionId, response));
        return this;
    }

    private Behavior<ConsultationCommand> onGetSummary(GetSummary msg) {
        msg.replyTo.tell(new SummaryReply(msg.sessionId, session.summary()));
        return this;
    }

    private Behavior<ConsultationCommand> onPostStop() {
        logger.tell(new LogEvent(session.sessionId(), "ConsultationSessionActor",
            "Session closed, context discarded", "DEBUG"));
        logger.tell(new CloseAudit(session.sessionId()));
        return this;
    }
}
