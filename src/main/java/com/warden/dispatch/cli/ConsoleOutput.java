package com.warden.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Warden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(String state) {
        String color = switch (state) {
            case "COMPLETED" -> "fg(green)";
            case "FAILED", "INTERRUPTED" -> "fg(red)";
            case "CANCELLED" -> "fg(yellow)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "State: @|bold," + color + " " + state + "|@"));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "message" -> "@|fg(white) [MESSAGE]|@";
            case "tool_use" -> "@|fg(blue) [TOOL]|@";
            case "tool_result" -> "@|fg(blue) [RESULT]|@";
            case "status" -> "@|fg(magenta) [STATUS]|@";
            case "result" -> "@|fg(green),bold [DONE]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long seconds) {
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }
}
