package com.github.acprelay.bridge;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Agent CLIs that speak ACP over stdio.
 */
public enum CliAgentType {
    GEMINI("gemini", "Gemini CLI", "gemini"),
    OPENCODE("opencode", "OpenCode", "opencode"),
    QWEN("qwen", "Qwen CLI", "qwen");

    private final String id;
    private final String displayName;
    private final String defaultCommand;

    CliAgentType(String id, String displayName, String defaultCommand) {
        this.id = id;
        this.displayName = displayName;
        this.defaultCommand = defaultCommand;
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getDisplayName() {
        return displayName;
    }

    @NotNull
    public String getDefaultCommand() {
        return defaultCommand;
    }

    /**
     * Parse a configured agent id (case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown id, listing the supported ones
     */
    @NotNull
    public static CliAgentType fromId(@NotNull String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CliAgentType type : values()) {
            if (type.id.equals(normalized)) return type;
        }
        String supported = Arrays.stream(values()).map(CliAgentType::getId).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid CLI_AGENT value: " + value + ". Supported values: " + supported);
    }
}
