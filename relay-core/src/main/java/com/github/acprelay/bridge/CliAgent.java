package com.github.acprelay.bridge;

import com.google.gson.JsonArray;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Describes the agent executable: how to launch it in ACP mode and how long to wait for it to stop.
 */
public class CliAgent {
    private static final Logger LOG = LoggerFactory.getLogger(CliAgent.class);
    private static final long VALIDATE_TIMEOUT_SECONDS = 10;
    public static final long DEFAULT_KILL_GRACE_MS = 5000;

    private final CliAgentType type;
    private final String command;
    private final String approvalMode;
    private final String model;
    private final List<String> includeDirectories;
    private final long killGraceMs;

    public CliAgent(@NotNull CliAgentType type, @Nullable String command, @Nullable String approvalMode,
                    @Nullable String model, @NotNull List<String> includeDirectories, long killGraceMs) {
        this.type = type;
        this.command = command == null || command.isBlank() ? type.getDefaultCommand() : command.trim();
        this.approvalMode = blankToNull(approvalMode);
        this.model = blankToNull(model);
        this.includeDirectories = List.copyOf(includeDirectories);
        this.killGraceMs = killGraceMs;
    }

    public CliAgent(@NotNull CliAgentType type) {
        this(type, null, null, null, List.of(), DEFAULT_KILL_GRACE_MS);
    }

    @NotNull
    public CliAgentType getType() {
        return type;
    }

    @NotNull
    public String getCommand() {
        return command;
    }

    @NotNull
    public String getDisplayName() {
        return type.getDisplayName();
    }

    public long getKillGraceMs() {
        return killGraceMs;
    }

    /**
     * Arguments that put the CLI into ACP mode, plus include-directories, approval mode and model override.
     */
    @NotNull
    public List<String> buildAcpArgs() {
        List<String> args = new ArrayList<>();
        args.add("--experimental-acp");
        for (String dir : new LinkedHashSet<>(includeDirectories)) {
            args.add("--include-directories");
            args.add(dir);
        }
        if (approvalMode != null) {
            args.add("--approval-mode");
            args.add(approvalMode);
        }
        if (model != null) {
            args.add("--model");
            args.add(model);
        }
        return args;
    }

    /**
     * MCP servers this agent wants passed to {@code session/new}. Empty means "use the configured JSON".
     */
    @NotNull
    public JsonArray getMcpServersForAcp() {
        return new JsonArray();
    }

    /**
     * Check that the CLI can be executed by running {@code <command> --version}.
     */
    @NotNull
    public ValidationResult validate() {
        try {
            Process check = new ProcessBuilder(command, "--version")
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
            if (!check.waitFor(VALIDATE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                check.destroyForcibly();
                return ValidationResult.invalid("Timed out validating " + getDisplayName() + " (" + command + ")");
            }
            return ValidationResult.ok();
        } catch (IOException e) {
            LOG.debug("Failed to run {} --version", command, e);
            return ValidationResult.invalid(getDisplayName() + " executable not found: " + command
                + ". Install " + getDisplayName() + " or set CLI_AGENT_COMMAND to a valid executable path.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ValidationResult.invalid("Interrupted while validating " + getDisplayName());
        }
    }

    @Nullable
    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record ValidationResult(boolean valid, @Nullable String error) {
        static ValidationResult ok() {
            return new ValidationResult(true, null);
        }

        static ValidationResult invalid(@NotNull String error) {
            return new ValidationResult(false, error);
        }
    }
}
