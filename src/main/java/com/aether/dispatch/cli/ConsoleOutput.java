package com.aether.dispatch.cli;

import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.MissionExecution;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Aether CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AETHER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AETHER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void lifecycle(AgentLifecycleState state) {
        String color = switch (state) {
            case ONLINE_IDLE -> "fg(green)";
            case ONLINE_ARMED, IN_MISSION -> "fg(blue)";
            case ERROR -> "fg(red),bold";
            case OFFLINE -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  State: @|" + color + " " + state + "|@"));
    }

    public static void mission(String label, MissionExecution m) {
        String phaseColor = switch (m.phase()) {
            case COMPLETED -> "fg(green)";
            case ABORTED -> "fg(red)";
            default -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + label + ": " + m.missionId() + " @|" + phaseColor + " " + m.phase() + "|@" +
                (m.observed() ? " (observed)" : "") +
                " step " + m.currentStepIndex() + "/" + m.totalSteps()));
        if (m.abortReason() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) " + m.abortReason() + "|@ " + (m.detail() != null ? m.detail() : "")));
        }
        if (m.startTime() != null && m.endTime() != null) {
            System.out.println("    Duration: " + formatDuration(m.endTime() - m.startTime()));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
