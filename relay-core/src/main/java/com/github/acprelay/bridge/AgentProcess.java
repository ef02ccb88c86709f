package com.github.acprelay.bridge;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Supervises one agent subprocess: owns its streams, mirrors stderr into a bounded tail,
 * reports exit, and terminates it with SIGTERM then SIGKILL escalation.
 */
final class AgentProcess {
    private static final Logger LOG = LoggerFactory.getLogger(AgentProcess.class);

    private final Process process;
    private final String displayName;
    private final String stderrPrefix;
    private final StderrTail stderrTail;
    private final Runnable onStderrActivity;
    private volatile boolean terminating = false;

    private AgentProcess(Process process, String displayName, String stderrPrefix,
                         StderrTail stderrTail, Runnable onStderrActivity) {
        this.process = process;
        this.displayName = displayName;
        this.stderrPrefix = stderrPrefix;
        this.stderrTail = stderrTail;
        this.onStderrActivity = onStderrActivity;
    }

    /**
     * Spawn the agent and start mirroring its stderr.
     *
     * @param onStderrActivity invoked for every stderr line, after it has been added to the tail
     */
    @NotNull
    static AgentProcess start(@NotNull ProcessLauncher launcher,
                              @NotNull List<String> command,
                              @NotNull String displayName,
                              @NotNull StderrTail stderrTail,
                              @NotNull Runnable onStderrActivity) throws ProcessSpawnException {
        Process process;
        try {
            process = launcher.launch(command);
        } catch (IOException | RuntimeException e) {
            throw new ProcessSpawnException("Failed to start " + displayName + " ACP process ("
                + command.get(0) + "): " + e.getMessage(), e);
        }

        AgentProcess agentProcess = new AgentProcess(process, displayName,
            stderrPrefixFor(command.get(0)), stderrTail, onStderrActivity);
        Thread stderrThread = new Thread(agentProcess::readStderrLoop, "acp-agent-stderr");
        stderrThread.setDaemon(true);
        stderrThread.start();
        LOG.info("Started {} ACP process (PID: {})", displayName, agentProcess.pid());
        return agentProcess;
    }

    /** Last path segment of the command, lower-cased, whitespace replaced with dashes. */
    @NotNull
    static String stderrPrefixFor(@NotNull String command) {
        String[] parts = command.split("[\\\\/]");
        String token = parts.length == 0 || parts[parts.length - 1].isEmpty() ? command : parts[parts.length - 1];
        return token.toLowerCase().replaceAll("\\s+", "-");
    }

    @NotNull
    InputStream getStdout() {
        return process.getInputStream();
    }

    @NotNull
    OutputStream getStdin() {
        return process.getOutputStream();
    }

    long pid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }

    boolean isAlive() {
        return process.isAlive() && !terminating;
    }

    /**
     * Register an exit callback. It runs on a pool thread, never on the thread that killed the process.
     */
    void onExit(@NotNull IntConsumer handler) {
        process.onExit().thenAcceptAsync(p -> {
            int code;
            try {
                code = p.exitValue();
            } catch (IllegalThreadStateException e) {
                code = -1;
            }
            handler.accept(code);
        });
    }

    /**
     * Ask the process to stop; force-kill it when it is still alive after {@code graceMs}.
     */
    void terminate(@NotNull String reason, long graceMs) {
        terminating = true;
        if (!process.isAlive()) {
            LOG.info("{} process termination finalized (reason={}, outcome=already-exited)", displayName, reason);
            return;
        }

        LOG.info("Sending SIGTERM to {} process (PID: {}, graceMs={}, reason={})", displayName, pid(), graceMs, reason);
        process.destroy();
        String outcome = "exit";
        try {
            if (!process.waitFor(Math.max(0, graceMs), TimeUnit.MILLISECONDS)) {
                LOG.warn("Escalating {} process termination to SIGKILL (PID: {})", displayName, pid());
                process.destroyForcibly();
                outcome = "sigkill";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            outcome = "sigkill";
        }
        LOG.info("{} process termination finalized (reason={}, outcome={})", displayName, reason, outcome);
    }

    private void readStderrLoop() {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                stderrTail.append(line + "\n");
                String text = line.trim();
                if (!text.isEmpty()) {
                    LOG.warn("[{}] {}", stderrPrefix, text);
                }
                onStderrActivity.run();
            }
        } catch (IOException e) {
            if (!terminating) {
                LOG.debug("Stderr reader for {} ended: {}", displayName, e.getMessage());
            }
        }
    }
}
