package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Set;

/**
 * Recognizes control commands typed into the chat.
 */
public final class CommandText {

    private static final Set<String> ABORT_COMMANDS = Set.of("abort", "cancel", "stop", "/abort", "/cancel", "/stop");
    private static final Set<String> POLITE_ABORT_COMMANDS = Set.of("please abort", "please cancel", "please stop");
    private static final Set<String> SHUTDOWN_COMMANDS = Set.of(
        "shutdown", "/shutdown", "shutdown agent", "kill agent", "please shutdown", "shutdown the agent");

    private CommandText() {
    }

    /**
     * Trimmed, lower-cased, trailing {@code !?.} removed.
     */
    @NotNull
    public static String normalize(@Nullable String text) {
        if (text == null) return "";
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("[!?.]+$", "");
    }

    public static boolean isAbortCommand(@Nullable String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return false;
        if (ABORT_COMMANDS.contains(normalized)) return true;
        return POLITE_ABORT_COMMANDS.contains(normalized.replaceAll("\\s+", " "));
    }

    public static boolean isShutdownCommand(@Nullable String text) {
        String normalized = normalize(text);
        return !normalized.isEmpty() && SHUTDOWN_COMMANDS.contains(normalized);
    }
}
