package com.github.acprelay.bridge;

import com.github.acprelay.services.MemoryProvider;
import com.github.acprelay.services.RelaySettings;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Owns the single agent session: process, ACP connection and session id.
 * <p>
 * Every mutation of the session goes through {@link #setState}, which rejects transitions the
 * current state does not allow, so callbacks arriving late (a timer after settlement, the exit of
 * a process that was already replaced) cannot corrupt the session.
 */
public class AcpRuntimeManager implements PromptRunner, Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(AcpRuntimeManager.class);

    public static final String NO_RESPONSE = "No response received.";
    static final String PROMPT_IN_PROGRESS = "Cannot start a new prompt while another is already in progress.";
    static final String SHUTTING_DOWN_MESSAGE = "Cannot start a new prompt while shutting down.";
    private static final String CONTEXT_UPDATE_TEMPLATE = "[SYSTEM: CONTEXT UPDATE]\n"
        + "The following is the result of a background task you previously scheduled. \n"
        + "Please incorporate this into your current context. \n"
        + "DO NOT respond to this message now. \n"
        + "DO NOT generate any visible output or message chunks.\n"
        + "Acknowledge silently and wait for the next user input.\n"
        + "\n"
        + "Result:\n";

    private final CliAgent cliAgent;
    private final RelaySettings settings;
    private final MemoryProvider memory;
    private final ProcessLauncher launcher;
    private final String displayName;
    private final StderrTail stderrTail;
    private final ScheduledExecutorService timers;
    private final ExecutorService background;
    private final AtomicBoolean promptGuard = new AtomicBoolean(false);
    private final Object lock = new Object();

    // Session: all three set together or all null
    private AcpState state = AcpState.IDLE;
    private AgentProcess agentProcess;
    private AcpConnection connection;
    private String sessionId;

    // Handshake in flight (not yet part of the session)
    private CompletableFuture<Void> sessionReady;
    private AgentProcess handshakeProcess;
    private AcpConnection handshakeConnection;

    private volatile PromptInvocation activeInvocation;
    private volatile boolean manualAbortRequested = false;
    private ScheduledFuture<?> prewarmRetryTimer;
    private int prewarmRetryAttempts = 0;
    private volatile boolean closed = false;

    public AcpRuntimeManager(@NotNull CliAgent cliAgent, @NotNull RelaySettings settings,
                             @NotNull MemoryProvider memory, @NotNull ProcessLauncher launcher) {
        this.cliAgent = cliAgent;
        this.settings = settings;
        this.memory = memory;
        this.launcher = launcher;
        this.displayName = cliAgent.getDisplayName();
        this.stderrTail = new StderrTail(settings.getStderrTailMaxChars());
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("acp-runtime-timer"));
        this.background = Executors.newSingleThreadExecutor(daemonThreads("acp-runtime-prewarm"));
    }

    public AcpRuntimeManager(@NotNull CliAgent cliAgent, @NotNull RelaySettings settings, @NotNull MemoryProvider memory) {
        this(cliAgent, settings, memory, ProcessLauncher.system());
    }

    private static ThreadFactory daemonThreads(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    // ========================
    // State
    // ========================

    /**
     * Validate and apply a transition. Must be called with {@link #lock} held.
     */
    private boolean setState(@NotNull AcpState newState) {
        if (state == newState) return true;
        if (!state.canTransitionTo(newState)) {
            LOG.warn("Ignoring invalid AcpRuntime transition {} -> {} (session={})", state, newState, sessionId);
            return false;
        }
        LOG.info("AcpRuntime state transition {} -> {} (session={})", state, newState, sessionId);
        state = newState;
        return true;
    }

    private boolean hasHealthyRuntime() {
        return (state == AcpState.READY || state == AcpState.PROMPTING)
            && connection != null && !connection.isClosed()
            && sessionId != null
            && agentProcess != null && agentProcess.isAlive();
    }

    @NotNull
    public RuntimeState getRuntimeState() {
        synchronized (lock) {
            return new RuntimeState(sessionId != null, agentProcess != null && agentProcess.isAlive(), state);
        }
    }

    public boolean hasActivePrompt() {
        synchronized (lock) {
            return state == AcpState.PROMPTING && activeInvocation != null;
        }
    }

    /**
     * Command and arguments used to spawn the agent.
     */
    @NotNull
    public List<String> buildAgentAcpArgs() {
        return cliAgent.buildAcpArgs();
    }

    // ========================
    // Session establishment
    // ========================

    /**
     * Make sure a healthy session exists. Concurrent callers share one in-flight handshake.
     */
    public void ensureSession() throws AcpException {
        try {
            memory.ensureMemoryFile();
        } catch (RuntimeException e) {
            throw new AcpException("Failed to prepare agent memory: " + e.getMessage(), e, true);
        }

        CompletableFuture<Void> handshake;
        boolean owner = false;
        synchronized (lock) {
            if (closed) throw new AcpException("ACP runtime is closed", null, false);
            if (hasHealthyRuntime()) return;
            if (sessionReady != null) {
                handshake = sessionReady;
            } else {
                if (state != AcpState.IDLE && state != AcpState.ERROR) {
                    LOG.warn("Cannot ensure session in state {}", state);
                    throw new AcpException("Cannot start an ACP session in state " + state, null, true);
                }
                setState(AcpState.STARTING);
                handshake = new CompletableFuture<>();
                sessionReady = handshake;
                owner = true;
            }
        }

        if (owner) {
            try {
                initializeSession();
                handshake.complete(null);
            } catch (AcpException e) {
                handshake.completeExceptionally(e);
                throw e;
            } catch (RuntimeException e) {
                AcpException wrapped = new AcpException(displayName + " ACP handshake failed: " + e.getMessage(), e, false);
                handshake.completeExceptionally(wrapped);
                throw wrapped;
            } finally {
                synchronized (lock) {
                    if (sessionReady == handshake) sessionReady = null;
                }
            }
            return;
        }

        try {
            handshake.get();
        } catch (ExecutionException e) {
            throw asAcpException(e.getCause(), displayName + " ACP handshake failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcpException("Interrupted while waiting for ACP session", e, true);
        }
    }

    private void initializeSession() throws AcpException {
        List<String> command = new ArrayList<>();
        command.add(cliAgent.getCommand());
        command.addAll(cliAgent.buildAcpArgs());
        JsonArray mcpServers = resolveMcpServers();

        LOG.info("Starting {} ACP process: {}", displayName, command);
        stderrTail.clear();

        AgentProcess process;
        try {
            process = AgentProcess.start(launcher, command, displayName, stderrTail, this::onStderrActivity);
        } catch (ProcessSpawnException e) {
            LOG.warn("{}", e.getMessage());
            synchronized (lock) {
                if (setState(AcpState.ERROR)) setState(AcpState.IDLE);
            }
            throw e;
        }

        AcpConnection conn = new AcpConnection(process.getStdout(), process.getStdin(),
            new RuntimeClientHandler(), () -> onConnectionClosed(process));
        process.onExit(code -> onProcessExit(process, conn, code));
        synchronized (lock) {
            handshakeProcess = process;
            handshakeConnection = conn;
        }

        try {
            conn.start();
            conn.initialize(settings.getRequestTimeoutMs());
            String newSessionId = conn.newSession(System.getProperty("user.dir"), mcpServers, settings.getRequestTimeoutMs());

            synchronized (lock) {
                if (state != AcpState.STARTING) {
                    throw new AcpException("ACP runtime was shut down during the handshake", null, false);
                }
                handshakeProcess = null;
                handshakeConnection = null;
                agentProcess = process;
                connection = conn;
                sessionId = newSessionId;
                setState(AcpState.READY);
            }
            LOG.info("ACP session ready (session={}, mcpServersCount={}, mcpServerNames={})",
                newSessionId, mcpServers.size(), mcpServerNames(mcpServers));
        } catch (AcpException e) {
            String tail = stderrTail.snapshot();
            String message = e.getMessage() != null ? e.getMessage() : displayName + " ACP handshake failed";
            String hint = message.contains("Internal error")
                ? displayName + " ACP newSession returned Internal error. This is often caused by a local MCP server"
                + " or skill initialization issue. Try launching the CLI directly and checking MCP/skills diagnostics."
                : null;
            LOG.warn("ACP initialization failed: {} (stderrTail={})", message, tail.isEmpty() ? "(empty)" : tail);

            boolean ownsState;
            synchronized (lock) {
                handshakeProcess = null;
                handshakeConnection = null;
                ownsState = state == AcpState.STARTING && setState(AcpState.ERROR);
            }
            conn.close();
            process.terminate("handshake-failure", cliAgent.getKillGraceMs());
            if (ownsState) {
                synchronized (lock) {
                    setState(AcpState.IDLE);
                }
            }
            throw new HandshakeException(message, e, tail, hint);
        }
    }

    @NotNull
    private JsonArray resolveMcpServers() {
        JsonArray fromAgent = cliAgent.getMcpServersForAcp();
        if (!fromAgent.isEmpty()) {
            LOG.info("Using MCP servers from agent configuration (count={})", fromAgent.size());
            return fromAgent;
        }
        String json = settings.getMcpServersJson();
        if (json == null || json.isBlank()) return new JsonArray();
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (parsed.isJsonArray()) return parsed.getAsJsonArray();
            LOG.warn("Invalid ACP_MCP_SERVERS_JSON (not an array); using empty mcpServers array");
        } catch (JsonParseException e) {
            LOG.warn("Invalid ACP_MCP_SERVERS_JSON; using empty mcpServers array: {}", e.getMessage());
        }
        return new JsonArray();
    }

    @NotNull
    private static List<String> mcpServerNames(@NotNull JsonArray servers) {
        List<String> names = new ArrayList<>();
        for (JsonElement server : servers) {
            if (server.isJsonObject() && server.getAsJsonObject().has("name")) {
                String name = server.getAsJsonObject().get("name").getAsString();
                if (!name.isEmpty()) names.add(name);
            }
        }
        return names;
    }

    // ========================
    // Prewarm
    // ========================

    /**
     * Establish a session in the background. No-op when one is healthy, a handshake is running,
     * or a retry is already scheduled.
     */
    public void scheduleAcpPrewarm(@NotNull String reason) {
        synchronized (lock) {
            if (closed || hasHealthyRuntime() || sessionReady != null || prewarmRetryTimer != null) return;
        }
        LOG.info("Triggering ACP prewarm (reason={})", reason);
        try {
            background.execute(this::runPrewarm);
        } catch (RejectedExecutionException e) {
            LOG.debug("Prewarm rejected, runtime is closing");
        }
    }

    private void runPrewarm() {
        try {
            ensureSession();
            synchronized (lock) {
                prewarmRetryAttempts = 0;
            }
            LOG.info("{} ACP prewarm complete", displayName);
        } catch (AcpException e) {
            LOG.warn("{} ACP prewarm failed: {}", displayName, e.getMessage());
            synchronized (lock) {
                prewarmRetryAttempts++;
                int maxRetries = settings.getPrewarmMaxRetries();
                if (maxRetries > 0 && prewarmRetryAttempts >= maxRetries) {
                    LOG.warn("{} ACP prewarm retries exhausted; stopping automatic retries (attempts={}, maxRetries={})",
                        displayName, prewarmRetryAttempts, maxRetries);
                    return;
                }
                long retryMs = settings.getPrewarmRetryMs();
                if (retryMs > 0 && prewarmRetryTimer == null && !closed) {
                    prewarmRetryTimer = timers.schedule(() -> {
                        synchronized (lock) {
                            prewarmRetryTimer = null;
                        }
                        scheduleAcpPrewarm("retry");
                    }, retryMs, TimeUnit.MILLISECONDS);
                }
            }
        }
    }

    int getPrewarmRetryAttempts() {
        synchronized (lock) {
            return prewarmRetryAttempts;
        }
    }

    // ========================
    // Prompting
    // ========================

    /**
     * Send one prompt and block until it settles.
     *
     * @param onChunk receives each visible text fragment on the connection's reader thread
     * @return the accumulated reply, or {@value #NO_RESPONSE} when the agent produced no text
     */
    @NotNull
    @Override
    public String runPrompt(@NotNull String promptText, @Nullable Consumer<String> onChunk) throws AcpException {
        synchronized (lock) {
            if (state == AcpState.PROMPTING) throw new ConcurrentPromptException(PROMPT_IN_PROGRESS);
            if (state == AcpState.SHUTTING_DOWN) throw new ConcurrentPromptException(SHUTTING_DOWN_MESSAGE);
        }
        if (!promptGuard.compareAndSet(false, true)) {
            throw new ConcurrentPromptException(PROMPT_IN_PROGRESS);
        }
        try {
            return doRunPrompt(promptText, onChunk);
        } catch (AcpException e) {
            scheduleAcpPrewarm("prompt failure");
            throw e;
        } finally {
            promptGuard.set(false);
        }
    }

    @NotNull
    private String doRunPrompt(@NotNull String promptText, @Nullable Consumer<String> onChunk) throws AcpException {
        ensureSession();

        AcpConnection conn;
        String sid;
        PromptInvocation invocation = new PromptInvocation(
            "acp-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 6), onChunk);
        synchronized (lock) {
            if (!hasHealthyRuntime() || state != AcpState.READY) {
                throw new AcpException(displayName + " ACP session is not ready (state=" + state + ")", null, true);
            }
            setState(AcpState.PROMPTING);
            conn = connection;
            sid = sessionId;
            activeInvocation = invocation;
        }
        LOG.info("Starting ACP prompt (invocation={}, session={}, promptLength={})",
            invocation.getId(), sid, promptText.length());

        try {
            String augmented = memory.buildPromptWithMemory(promptText);

            long timeoutMs = settings.getTimeoutMs();
            if (timeoutMs > 0) {
                invocation.setOverallTimer(timers.schedule(() -> onPromptTimer(invocation,
                        new PromptTimeoutException(displayName + " ACP timed out after " + timeoutMs + "ms")),
                    timeoutMs, TimeUnit.MILLISECONDS));
            }
            refreshNoOutputTimer(invocation);

            CompletableFuture<JsonObject> request = conn.prompt(sid, augmented);
            invocation.setPendingRequest(request);
            request.whenComplete((result, error) -> {
                if (error != null) {
                    if (!(error instanceof CancellationException)) {
                        failInvocation(invocation, asAcpException(error, displayName + " ACP prompt failed"));
                    }
                } else {
                    onPromptResult(invocation, result);
                }
            });
        } catch (AcpException e) {
            failInvocation(invocation, e);
        } catch (RuntimeException e) {
            failInvocation(invocation, new AcpException(displayName + " ACP prompt failed: " + e.getMessage(), e, true));
        }

        boolean delivered = false;
        try {
            String response = invocation.getResult().get();
            delivered = true;
            return response;
        } catch (ExecutionException e) {
            throw asAcpException(e.getCause(), displayName + " ACP prompt failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelActivePrompt();
            AcpException interrupted = new AcpException(displayName + " ACP prompt interrupted", e, true);
            failInvocation(invocation, interrupted);
            throw interrupted;
        } finally {
            notifyPromptFinished(invocation, delivered);
        }
    }

    private void notifyPromptFinished(@NotNull PromptInvocation invocation, boolean delivered) {
        try {
            memory.onPromptFinished(delivered);
        } catch (RuntimeException e) {
            LOG.warn("Memory provider failed after prompt (invocation={}): {}", invocation.getId(), e.getMessage(), e);
        }
    }

    private void onPromptResult(@NotNull PromptInvocation invocation, @NotNull JsonObject result) {
        String stopReason = result.has("stopReason") && !result.get("stopReason").isJsonNull()
            ? result.get("stopReason").getAsString() : "";
        String text = invocation.getResponseText();
        if (settings.isDebugStream()) {
            LOG.info("ACP prompt stop reason (invocation={}, stopReason={}, chunkCount={}, bufferedLength={})",
                invocation.getId(), stopReason.isEmpty() ? "(none)" : stopReason,
                invocation.getChunkCount(), text.length());
        }

        if ("cancelled".equals(stopReason) && text.isEmpty()) {
            boolean manual = manualAbortRequested;
            failInvocation(invocation, new PromptCancelledException(manual
                ? displayName + " ACP prompt was aborted by user"
                : displayName + " ACP prompt was cancelled", manual));
            return;
        }
        resolveInvocation(invocation, text.isEmpty() ? NO_RESPONSE : text);
    }

    private void onPromptTimer(@NotNull PromptInvocation invocation, @NotNull AcpException error) {
        if (invocation.isSettled()) return;
        if (activeInvocation == invocation) {
            cancelActivePrompt();
        }
        failInvocation(invocation, error);
    }

    private void refreshNoOutputTimer(@NotNull PromptInvocation invocation) {
        long noOutputMs = settings.getNoOutputTimeoutMs();
        if (noOutputMs <= 0 || invocation.isSettled()) return;
        try {
            invocation.replaceNoOutputTimer(timers.schedule(() -> onPromptTimer(invocation,
                    new PromptNoOutputTimeoutException(displayName + " ACP produced no output for " + noOutputMs + "ms")),
                noOutputMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            LOG.debug("No-output timer rejected, runtime is closing");
        }
    }

    private void onStderrActivity() {
        PromptInvocation invocation = activeInvocation;
        if (invocation != null) {
            refreshNoOutputTimer(invocation);
        }
    }

    private void resolveInvocation(@NotNull PromptInvocation invocation, @NotNull String value) {
        if (!settle(invocation)) return;
        LOG.info("ACP prompt completed (invocation={}, chunkCount={}, firstChunkDelayMs={}, elapsedMs={}, responseLength={})",
            invocation.getId(), invocation.getChunkCount(), invocation.getFirstChunkDelayMs(),
            invocation.getElapsedMs(), value.length());
        invocation.getResult().complete(value);
    }

    private void failInvocation(@NotNull PromptInvocation invocation, @NotNull AcpException error) {
        if (!settle(invocation)) return;
        completeFailure(invocation, error);
    }

    private void completeFailure(@NotNull PromptInvocation invocation, @NotNull AcpException error) {
        LOG.warn("ACP prompt failed (invocation={}, chunkCount={}, firstChunkDelayMs={}, elapsedMs={}): {}",
            invocation.getId(), invocation.getChunkCount(), invocation.getFirstChunkDelayMs(),
            invocation.getElapsedMs(), error.getMessage());
        invocation.getResult().completeExceptionally(error);
    }

    /**
     * Claim settlement and return the session to READY if it is still prompting on a healthy runtime.
     * A prompt that ends on a dead connection resets the runtime before the caller is released.
     */
    private boolean settle(@NotNull PromptInvocation invocation) {
        AgentProcess lostProcess = null;
        synchronized (lock) {
            if (!claim(invocation)) return false;
            if (state == AcpState.PROMPTING) {
                if (hasHealthyRuntime()) {
                    setState(AcpState.READY);
                } else {
                    lostProcess = agentProcess;
                }
            }
        }
        if (lostProcess != null) {
            handleRuntimeFault(lostProcess, "connection-lost", null);
        }
        return true;
    }

    /**
     * Take the single settlement of {@code invocation} and stop its timers. Must be called with {@link #lock} held.
     */
    private boolean claim(@NotNull PromptInvocation invocation) {
        if (!invocation.markSettled()) return false;
        invocation.release();
        manualAbortRequested = false;
        if (activeInvocation == invocation) activeInvocation = null;
        return true;
    }

    /**
     * Ask the agent to stop the current turn. Best effort; the prompt settles when the agent answers
     * or a timer fires.
     */
    public void cancelActivePrompt() {
        AcpConnection conn;
        String sid;
        synchronized (lock) {
            conn = connection;
            sid = sessionId;
        }
        if (conn == null || sid == null) return;
        try {
            conn.cancel(sid);
        } catch (AcpException e) {
            LOG.debug("session/cancel failed: {}", e.getMessage());
        }
    }

    /**
     * Mark the next cancellation as user-requested. Consumed when the current prompt settles.
     */
    public void requestManualAbort() {
        manualAbortRequested = true;
    }

    /**
     * Inject out-of-band context into an idle session without waiting for the reply.
     *
     * @return false when suppressed (no healthy session, or a prompt is in flight)
     */
    public boolean appendContext(@NotNull String text) {
        AcpConnection conn;
        String sid;
        synchronized (lock) {
            if (!hasHealthyRuntime() || state == AcpState.PROMPTING || activeInvocation != null) {
                LOG.info("Context update suppressed (state={}, textLength={})", state, text.length());
                return false;
            }
            conn = connection;
            sid = sessionId;
        }
        LOG.info("Appending context to ACP session (session={}, textLength={})", sid, text.length());
        try {
            conn.prompt(sid, CONTEXT_UPDATE_TEMPLATE + text).whenComplete((result, error) -> {
                if (error != null) {
                    LOG.info("Context update fire-and-forget failed: {}", error.getMessage());
                }
            });
            return true;
        } catch (AcpException e) {
            LOG.warn("Failed to append context to ACP session: {}", e.getMessage());
            return false;
        }
    }

    // ========================
    // Faults and teardown
    // ========================

    private void onProcessExit(@NotNull AgentProcess process, @NotNull AcpConnection conn, int code) {
        boolean current;
        synchronized (lock) {
            current = agentProcess == process;
        }
        if (!current) {
            // Handshake still running or process already replaced: unblock anything waiting on it.
            conn.close();
            return;
        }
        LOG.warn("{} ACP process closed (code={})", displayName, code);
        handleRuntimeFault(process, "process-exit",
            new AcpException(displayName + " ACP process exited (code=" + code + ")", null, false));
    }

    private void onConnectionClosed(@NotNull AgentProcess process) {
        handleRuntimeFault(process, "connection-closed",
            new AcpException(displayName + " ACP connection closed", null, false));
    }

    /**
     * Reset after the agent died. The in-flight prompt, if any, is claimed together with the move to ERROR
     * and only failed once the runtime is back in IDLE.
     *
     * @param error failure for the in-flight prompt, or null when the caller already settled it
     */
    private void handleRuntimeFault(@NotNull AgentProcess process, @NotNull String reason, @Nullable AcpException error) {
        PromptInvocation claimed = null;
        synchronized (lock) {
            // Exit and end-of-stream both report the same fault; only the first one resets.
            if (agentProcess != process || (state != AcpState.READY && state != AcpState.PROMPTING)) return;
            setState(AcpState.ERROR);
            PromptInvocation invocation = activeInvocation;
            if (error != null && invocation != null && claim(invocation)) {
                claimed = invocation;
            }
        }
        LOG.info("Resetting ACP runtime state (reason={})", reason);
        teardown("runtime-reset");
        scheduleAcpPrewarm("runtime reset");
        if (claimed != null) {
            completeFailure(claimed, error);
        }
    }

    /**
     * Stop the agent and clear the session. Pending automatic prewarm retries are cancelled too.
     */
    public void shutdown(@NotNull String reason) {
        synchronized (lock) {
            if (prewarmRetryTimer != null) {
                prewarmRetryTimer.cancel(false);
                prewarmRetryTimer = null;
            }
        }
        teardown(reason);
    }

    private void teardown(@NotNull String reason) {
        AgentProcess process;
        AcpConnection conn;
        AgentProcess pendingProcess;
        AcpConnection pendingConnection;
        PromptInvocation claimed = null;
        String oldSessionId;
        synchronized (lock) {
            setState(AcpState.SHUTTING_DOWN);
            process = agentProcess;
            conn = connection;
            oldSessionId = sessionId;
            pendingProcess = handshakeProcess;
            pendingConnection = handshakeConnection;
            PromptInvocation invocation = activeInvocation;
            if (invocation != null && claim(invocation)) {
                claimed = invocation;
            }
            agentProcess = null;
            connection = null;
            sessionId = null;
            handshakeProcess = null;
            handshakeConnection = null;
            activeInvocation = null;
        }

        if (conn != null) conn.close();
        if (pendingConnection != null) pendingConnection.close();
        if (process != null) process.terminate(reason, cliAgent.getKillGraceMs());
        if (pendingProcess != null) pendingProcess.terminate(reason, cliAgent.getKillGraceMs());
        stderrTail.clear();

        synchronized (lock) {
            setState(AcpState.IDLE);
        }
        if (oldSessionId != null) {
            LOG.info("ACP runtime shut down (reason={}, session={})", reason, oldSessionId);
        }
        if (claimed != null) {
            completeFailure(claimed, new AcpException(displayName + " ACP runtime shut down (" + reason + ")", null, false));
        }
    }

    /**
     * Shut down the agent and stop the runtime's own threads. The manager cannot be reused.
     */
    @Override
    public void close() {
        closed = true;
        shutdown("close");
        timers.shutdownNow();
        background.shutdownNow();
    }

    @NotNull
    private static AcpException asAcpException(@Nullable Throwable error, @NotNull String fallbackMessage) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof AcpException acpException) return acpException;
        String message = cause != null && cause.getMessage() != null ? cause.getMessage() : fallbackMessage;
        return new AcpException(message, cause, false);
    }

    // ========================
    // Inbound ACP requests
    // ========================

    private final class RuntimeClientHandler implements AcpClientHandler {

        @NotNull
        @Override
        public JsonObject requestPermission(@NotNull JsonObject params) {
            JsonArray options = params.has("options") && params.get("options").isJsonArray()
                ? params.getAsJsonArray("options") : null;
            return PermissionStrategy.buildResponse(options, settings.getPermissionStrategy());
        }

        @Override
        public void sessionUpdate(@NotNull String updateSessionId, @NotNull SessionUpdate update) {
            PromptInvocation invocation;
            synchronized (lock) {
                if (!updateSessionId.equals(sessionId)) return;
                invocation = activeInvocation;
            }
            if (invocation == null) return;

            refreshNoOutputTimer(invocation);

            if (update.kind() == SessionUpdate.Kind.AGENT_THOUGHT_CHUNK) {
                if (settings.isDebugStream()) {
                    String thought = update.text() != null ? update.text() : "";
                    LOG.info("ACP thought chunk (session={}, thoughtLength={}, thoughtPreview={})",
                        updateSessionId, thought.length(), thought.substring(0, Math.min(100, thought.length())));
                }
                return;
            }
            if (!update.isMessageText() || update.text().isEmpty()) {
                LOG.debug("ACP session update ignored (kind={})", update.kind());
                return;
            }
            deliverChunk(invocation, update.text());
        }

        private void deliverChunk(@NotNull PromptInvocation invocation, @NotNull String text) {
            int bufferedBefore = invocation.getBufferedLength();
            if (!invocation.append(text)) return;
            if (settings.isDebugStream()) {
                LOG.info("ACP chunk received (invocation={}, chunkIndex={}, chunkLength={}, elapsedMs={}, bufferLengthBeforeAppend={})",
                    invocation.getId(), invocation.getChunkCount(), text.length(), invocation.getElapsedMs(), bufferedBefore);
            }
            if (settings.isStreamStdout()) {
                System.out.print(text);
                System.out.flush();
            }
            Consumer<String> onChunk = invocation.getOnChunk();
            if (onChunk != null) {
                try {
                    onChunk.accept(text);
                } catch (RuntimeException e) {
                    LOG.warn("Chunk consumer failed (invocation={})", invocation.getId(), e);
                }
            }
        }

        @NotNull
        @Override
        public JsonObject readTextFile(@NotNull JsonObject params) {
            JsonObject result = new JsonObject();
            result.addProperty("content", "");
            return result;
        }

        @NotNull
        @Override
        public JsonObject writeTextFile(@NotNull JsonObject params) {
            return new JsonObject();
        }
    }

    /**
     * Snapshot for status reporting.
     */
    public record RuntimeState(boolean sessionReady, boolean processRunning, @NotNull AcpState state) {
    }
}
