package com.navcaddy.dispatch.cli;

import com.navcaddy.core.engine.TurnOutcome;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.RoutingTarget;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the NavCaddy CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) NAVCADDY v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [NAVCADDY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void caddy(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(green) [BONES]|@ ") + message);
    }

    public static void turn(TurnOutcome outcome) {
        String header = switch (outcome.outcome()) {
            case ROUTE -> "@|fg(green),bold [ROUTE]|@";
            case CONFIRM -> "@|fg(yellow),bold [CONFIRM]|@";
            case CLARIFY -> "@|fg(magenta),bold [CLARIFY]|@";
            case ERROR -> "@|fg(red),bold [ERROR]|@";
        };
        String detail = "";
        if (outcome.intent() != null) {
            detail = " " + outcome.intent().intentType()
                    + String.format(Locale.ROOT, " (%.2f)", outcome.intent().confidence());
        }
        if (outcome.errorKind() != null) {
            detail += " " + outcome.errorKind() + (outcome.recoverable() ? ", recoverable" : "");
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(header) + detail);

        RoutingTarget target = outcome.target();
        if (target != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(blue) ->|@ " + target.module() + "/" + target.screen()
                            + (target.parameters().isEmpty() ? "" : " " + target.parameters())));
        }
        caddy(outcome.message());
        int i = 1;
        for (IntentSuggestion suggestion : outcome.suggestions()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(magenta) " + i++ + ".|@ " + suggestion.label()) + " - " + suggestion.description());
        }
    }
}
