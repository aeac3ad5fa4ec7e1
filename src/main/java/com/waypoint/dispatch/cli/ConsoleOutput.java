package com.waypoint.dispatch.cli;

import com.waypoint.core.model.MissionError;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Waypoint CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAYPOINT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAYPOINT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public static void missionError(MissionError error) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) [" + error.category() + "]|@ @|faint " + error.phase() + "|@ "
                        + firstLine(error.message())));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "mission.created" -> "@|fg(cyan) [MISSION]|@";
            case "phase.entered" -> "@|fg(blue) [PHASE]|@";
            case "phase.retry" -> "@|fg(yellow) [RETRY]|@";
            case "mission.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "mission.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline) + " ...";
    }
}
