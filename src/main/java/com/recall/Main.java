package com.recall;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.recall.actors.ConsultationManagerActor;
import com.recall.config.EngineSettings;
import com.recall.engine.RecallEngineFactory;
import com.recall.engine.RecallEngineFactory.Components;
import com.recall.messages.Messages.*;
import com.recall.retrieval.CorpusUnavailableException;
import com.recall.policy.PolicyException;
import com.recall.speech.LoggingSpeechSynthesizer;

import java.io.IOException;
import java.time.Clock;
import java.util.Scanner;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.TimeUnit;

/**
 * Field Recall Engine - Console entry point
 * Builds the engine once, then runs one consultation session per conversation
 */
public class Main {

    public static void main(String[] args) {
        System.out.println("🏥 Initializing Field Recall Engine...");

        EngineSettings settings = EngineSettings.load();
        Components components;
        try {
            components = RecallEngineFactory.create(settings, Clock.systemUTC());
        } catch (IOException | CorpusUnavailableException | PolicyException e) {
            System.err.println("❌ Engine failed to start: " + e.getMessage());
            System.exit(1);
            return;
        }

        ActorSystem<ConsultationCommand> system = ActorSystem.create(
            ConsultationManagerActor.create(components, settings.historySize, LoggingSpeechSynthesizer::new),
            "FieldRecallSystem");

        runConsole(system, settings);
    }

    private static void runConsole(ActorSystem<ConsultationCommand> system, EngineSettings settings) {
        Scanner scanner = new Scanner(System.in);
        String sessionId = newSessionId();

        System.out.println("\n🏥 ============================================");
        System.out.println("🏥 FIELD RECALL ENGINE");
        System.out.println("🏥 ============================================");
        System.out.println("💬 Commands: 'new' new patient, 'summary' hand-off summary, 'help', 'quit'\n");
        System.out.println("🆔 Session: " + sessionId);

        while (true) {
            System.out.print("\n🎙️  Medic: ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();

            if (input.equalsIgnoreCase("quit") || input.equalsIgnoreCase("exit")) {
                break;
            }
            if (input.equalsIgnoreCase("help")) {
                showHelp();
                continue;
            }
            if (input.equalsIgnoreCase("new")) {
                system.tell(new EndSession(sessionId));
                sessionId = newSessionId();
                System.out.println("🆔 New session: " + sessionId);
                continue;
            }
            if (input.equalsIgnoreCase("summary")) {
                showSummary(system, settings, sessionId);
                continue;
            }
            if (input.isEmpty()) {
                continue;
            }

            final String id = sessionId;
            try {
                TurnReply reply = AskPattern.<ConsultationCommand, TurnReply>ask(
                        system,
                        replyTo -> new HandleUtterance(id, input, replyTo),
                        settings.askTimeout,
                        system.scheduler())
                    .toCompletableFuture()
                    .get(settings.askTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
                System.out.println("🩺 " + reply.spokenText);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException | TimeoutException e) {
                System.err.println("❌ No answer from session " + id + ": " + e.getMessage());
            }
        }

        scanner.close();
        System.out.println("🔄 Shutting down...");
        system.terminate();
    }

    private static void showSummary(ActorSystem<ConsultationCommand> system, EngineSettings settings,
                                    String sessionId) {
        try {
            SummaryReply reply = AskPattern.<ConsultationCommand, SummaryReply>ask(
                    system,
                    replyTo -> new GetSummary(sessionId, replyTo),
                    settings.askTimeout,
                    system.scheduler())
                .toCompletableFuture()
                .get(settings.askTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            System.out.println(reply.found ? reply.summary.describe() : "📋 Nothing recorded yet.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            System.err.println("❌ Summary unavailable: " + e.getMessage());
        }
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static void showHelp() {
        System.out.println("\n📋 EXAMPLES:");
        System.out.println("─".repeat(60));
        System.out.println("   • \"patient is 80 kilograms, allergic to penicillin\"");
        System.out.println("   • \"heart rate 110, blood pressure 100/60, sats 94\"");
        System.out.println("   • \"ketamine for pain\"");
        System.out.println("   • \"airway obstruction\"");
        System.out.println("   • \"how do I manage a tension pneumothorax\"");
        System.out.println("   • \"current vitals\"");
        System.out.println("─".repeat(60));
    }
}
