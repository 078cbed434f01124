package com.rulewise.dispatch.cli;

import com.rulewise.core.model.AssembledRule;
import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.UserIntent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Rulewise CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) RULEWISE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RULEWISE]|@ " + message));
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

    public static void context(ProjectContext ctx) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Project|@ " + ctx.rootPath()));
        System.out.println("  Languages:  " + joinOrNone(ctx.languages()));
        System.out.println("  Frameworks: " + joinOrNone(ctx.frameworks()));
        System.out.println("  Cloud:      " + joinOrNone(ctx.cloudProviders()));
        System.out.println("  Maturity:   " + ctx.maturity().id());
        System.out.println("  Confidence: " + Math.round(ctx.confidence() * 100) + "%");
    }

    public static void intent(UserIntent intent) {
        System.out.println("  Topics:  " + joinOrNone(intent.topics()));
        System.out.println("  Action:  " + intent.action().name().toLowerCase());
        System.out.println("  Urgency: " + intent.urgency().name().toLowerCase());
    }

    public static void rule(int rank, AssembledRule rule) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + rank + ".|@ " + rule.descriptor().path()
                        + " @|faint (score " + rule.score() + ", ~"
                        + rule.descriptor().estimatedTokens() + " tokens)|@"));
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        return String.format("%.1fs", ms / 1000.0);
    }

    private static String joinOrNone(Iterable<String> values) {
        String joined = String.join(", ", values);
        return joined.isEmpty() ? "-" : joined;
    }
}
