package com.navcaddy.dispatch.cli;

import com.navcaddy.core.classifier.ClassificationCancelledException;
import com.navcaddy.core.engine.ConversationEngine;
import com.navcaddy.core.engine.TurnOutcome;
import com.navcaddy.core.events.InputType;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.CompletionException;

/**
 * CLI command: navcaddy ask "utterance"
 * <p>
 * Runs one utterance through a throwaway session and prints the outcome.
 */
@Command(name = "ask", mixinStandardHelpOptions = true,
        description = "Classify one utterance and show what the caddy would do")
@Component
public class AskCommand implements Runnable {

    private final ConversationEngine engine;

    @Parameters(index = "0", arity = "0..1", description = "What you would say to the caddy", defaultValue = "")
    private String utterance;

    @Option(names = {"--course"}, description = "Start a round on this course first")
    private String course;

    @Option(names = {"--hole"}, description = "Current hole (default: ${DEFAULT-VALUE})", defaultValue = "1")
    private int hole;

    @Option(names = {"--par"}, description = "Par of the current hole (default: ${DEFAULT-VALUE})", defaultValue = "4")
    private int par;

    @Option(names = {"--voice"}, description = "Treat the utterance as speech-to-text output")
    private boolean voice;

    public AskCommand(ConversationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String sessionId = engine.startSession();
        try {
            if (course != null && !course.isBlank()) {
                engine.updateRound(sessionId, "cli-round", course, hole, par);
                ConsoleOutput.info("Round started at " + course + ", hole " + hole + " (par " + par + ")");
            }
            ConsoleOutput.info("You: " + (utterance.isBlank() ? "(nothing)" : utterance));
            TurnOutcome outcome = engine.submit(sessionId, utterance, voice ? InputType.VOICE : InputType.TEXT)
                    .join();
            ConsoleOutput.turn(outcome);
        } catch (ClassificationCancelledException e) {
            ConsoleOutput.warn("Turn was cancelled");
        } catch (CompletionException e) {
            if (e.getCause() instanceof ClassificationCancelledException) {
                ConsoleOutput.warn("Turn was cancelled");
            } else {
                ConsoleOutput.error("Turn failed: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
            }
        } finally {
            engine.endSession(sessionId);
        }
    }
}
