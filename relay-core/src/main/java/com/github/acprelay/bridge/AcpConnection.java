package com.github.acprelay.bridge;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over newline-delimited JSON, client side of the Agent Client Protocol.
 * <p>
 * A reader thread parses agent output and routes it: responses complete pending requests,
 * agent requests go to the {@link AcpClientHandler} and are answered, notifications are
 * dispatched as {@link SessionUpdate}s.
 */
public class AcpConnection implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(AcpConnection.class);
    public static final int PROTOCOL_VERSION = 1;

    // JSON-RPC field names
    private static final String JSONRPC = "jsonrpc";
    private static final String ID = "id";
    private static final String METHOD = "method";
    private static final String PARAMS = "params";
    private static final String RESULT = "result";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";
    private static final String SESSION_ID = "sessionId";

    private static final int METHOD_NOT_FOUND = -32601;
    private static final int INTERNAL_ERROR = -32603;

    private final Gson gson = new Gson();
    private final AtomicLong requestIdCounter = new AtomicLong(1);
    private final ConcurrentHashMap<Long, CompletableFuture<JsonObject>> pendingRequests = new ConcurrentHashMap<>();
    private final Object writerLock = new Object();

    private final InputStream input;
    private final BufferedWriter writer;
    private final AcpClientHandler handler;
    private final Runnable onClosed;
    private Thread readerThread;
    private volatile boolean closed = false;

    /**
     * @param input    agent stdout
     * @param output   agent stdin
     * @param onClosed called once when the agent's output ends without {@link #close()} having been called
     */
    public AcpConnection(@NotNull InputStream input, @NotNull OutputStream output,
                         @NotNull AcpClientHandler handler, @NotNull Runnable onClosed) {
        this.input = input;
        this.writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.handler = handler;
        this.onClosed = onClosed;
    }

    public void start() {
        readerThread = new Thread(this::readLoop, "acp-connection-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    public boolean isClosed() {
        return closed;
    }

    // ---- Protocol methods ----

    /**
     * {@code initialize}: protocol version and (empty) client capabilities.
     */
    @NotNull
    public JsonObject initialize(long timeoutMs) throws AcpException {
        JsonObject params = new JsonObject();
        params.addProperty("protocolVersion", PROTOCOL_VERSION);
        params.add("clientCapabilities", new JsonObject());
        JsonObject clientInfo = new JsonObject();
        clientInfo.addProperty("name", "acp-relay");
        clientInfo.addProperty("version", "0.1.0");
        params.add("clientInfo", clientInfo);

        JsonObject result = sendRequest("initialize", params, timeoutMs);
        LOG.info("ACP initialized: {} capabilities={}",
            result.has("agentInfo") ? result.get("agentInfo") : "unknown agent",
            result.has("agentCapabilities") ? result.get("agentCapabilities") : "none");
        return result;
    }

    /**
     * {@code session/new}; returns the session id issued by the agent.
     */
    @NotNull
    public String newSession(@NotNull String cwd, @NotNull JsonArray mcpServers, long timeoutMs) throws AcpException {
        JsonObject params = new JsonObject();
        params.addProperty("cwd", cwd);
        params.add("mcpServers", mcpServers);
        JsonObject result = sendRequest("session/new", params, timeoutMs);
        if (!result.has(SESSION_ID) || result.get(SESSION_ID).isJsonNull()) {
            throw new AcpException("ACP session/new returned no sessionId", null, false);
        }
        return result.get(SESSION_ID).getAsString();
    }

    /**
     * {@code session/prompt} with a single text block. The future completes with the result
     * (carrying {@code stopReason}) or exceptionally with an {@link AcpException}.
     */
    @NotNull
    public CompletableFuture<JsonObject> prompt(@NotNull String sessionId, @NotNull String text) throws AcpException {
        JsonObject block = new JsonObject();
        block.addProperty("type", "text");
        block.addProperty("text", text);
        JsonArray prompt = new JsonArray();
        prompt.add(block);

        JsonObject params = new JsonObject();
        params.addProperty(SESSION_ID, sessionId);
        params.add("prompt", prompt);
        return sendRequestAsync("session/prompt", params);
    }

    /**
     * {@code session/cancel} notification.
     */
    public void cancel(@NotNull String sessionId) throws AcpException {
        JsonObject params = new JsonObject();
        params.addProperty(SESSION_ID, sessionId);
        sendNotification("session/cancel", params);
        LOG.info("Sent session/cancel for session {}", sessionId);
    }

    // ---- JSON-RPC plumbing ----

    /**
     * Send a JSON-RPC request and wait for the response.
     */
    @NotNull
    public JsonObject sendRequest(@NotNull String method, @NotNull JsonObject params, long timeoutMs) throws AcpException {
        CompletableFuture<JsonObject> future = sendRequestAsync(method, params);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new AcpException("ACP request timed out: " + method, e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AcpException acpException) throw acpException;
            throw new AcpException("ACP request failed: " + method + " - " + cause.getMessage(), cause, false);
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            throw new AcpException("ACP request interrupted: " + method, e, true);
        }
    }

    /**
     * Send a JSON-RPC request without waiting. Cancelling the returned future forgets the request.
     */
    @NotNull
    public CompletableFuture<JsonObject> sendRequestAsync(@NotNull String method, @NotNull JsonObject params) throws AcpException {
        if (closed) throw new AcpException("ACP connection is closed", null, false);
        long id = requestIdCounter.getAndIncrement();
        CompletableFuture<JsonObject> future = new CompletableFuture<>();
        pendingRequests.put(id, future);
        future.whenComplete((r, t) -> pendingRequests.remove(id));

        JsonObject request = new JsonObject();
        request.addProperty(JSONRPC, "2.0");
        request.addProperty(ID, id);
        request.addProperty(METHOD, method);
        request.add(PARAMS, params);
        LOG.debug("ACP request: {} id={}", method, id);
        try {
            writeMessage(request);
        } catch (IOException e) {
            pendingRequests.remove(id);
            throw new AcpException("ACP write failed: " + method, e, true);
        }
        return future;
    }

    public void sendNotification(@NotNull String method, @NotNull JsonObject params) throws AcpException {
        if (closed) throw new AcpException("ACP connection is closed", null, false);
        JsonObject notification = new JsonObject();
        notification.addProperty(JSONRPC, "2.0");
        notification.addProperty(METHOD, method);
        notification.add(PARAMS, params);
        try {
            writeMessage(notification);
        } catch (IOException e) {
            throw new AcpException("ACP write failed: " + method, e, true);
        }
    }

    private void writeMessage(@NotNull JsonObject message) throws IOException {
        String json = gson.toJson(message);
        synchronized (writerLock) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    /**
     * Write a response to an agent-to-client request (best effort: the agent may already be gone).
     */
    private void sendRawMessage(@NotNull JsonObject message) {
        try {
            writeMessage(message);
        } catch (IOException e) {
            LOG.warn("Failed to send ACP response: {}", e.getMessage());
        }
    }

    /**
     * Background thread that reads JSON-RPC messages from the agent's stdout.
     */
    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (!closed && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                processLine(line);
            }
        } catch (IOException e) {
            if (!closed) {
                LOG.warn("ACP reader thread ended: {}", e.getMessage());
            }
        }

        boolean unexpected = !closed;
        closed = true;
        // Owner reset happens before anyone waiting on a request is released.
        if (unexpected) {
            try {
                onClosed.run();
            } catch (RuntimeException e) {
                LOG.warn("ACP close handler failed: {}", e.getMessage(), e);
            }
        }
        failAllPendingRequests(unexpected ? "ACP connection closed by agent" : "ACP connection closed");
    }

    private void failAllPendingRequests(@NotNull String reason) {
        for (Map.Entry<Long, CompletableFuture<JsonObject>> entry : pendingRequests.entrySet()) {
            entry.getValue().completeExceptionally(new AcpException(reason, null, false));
        }
        pendingRequests.clear();
    }

    private void processLine(@NotNull String line) {
        try {
            JsonObject msg = JsonParser.parseString(line).getAsJsonObject();
            handleJsonRpcMessage(msg);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            LOG.warn("Failed to parse ACP message: {}", line, e);
        }
    }

    private void handleJsonRpcMessage(@NotNull JsonObject msg) {
        boolean hasId = msg.has(ID) && !msg.get(ID).isJsonNull();
        boolean hasMethod = msg.has(METHOD);

        if (hasId && hasMethod) {
            handleAgentRequest(msg);
        } else if (hasId) {
            handleResponseMessage(msg);
        } else if (hasMethod) {
            handleNotificationMessage(msg);
        }
    }

    private void handleResponseMessage(@NotNull JsonObject msg) {
        long id;
        try {
            id = msg.get(ID).getAsLong();
        } catch (NumberFormatException | UnsupportedOperationException e) {
            LOG.warn("Ignoring ACP response with non-numeric id: {}", msg.get(ID));
            return;
        }
        CompletableFuture<JsonObject> future = pendingRequests.remove(id);
        if (future == null) {
            LOG.debug("Ignoring ACP response for unknown or abandoned request id={}", id);
            return;
        }
        if (msg.has(ERROR)) {
            handleErrorResponse(msg, id, future);
        } else if (msg.has(RESULT) && msg.get(RESULT).isJsonObject()) {
            future.complete(msg.getAsJsonObject(RESULT));
        } else {
            future.complete(new JsonObject());
        }
    }

    private void handleErrorResponse(@NotNull JsonObject msg, long id, @NotNull CompletableFuture<JsonObject> future) {
        JsonElement errorElement = msg.get(ERROR);
        String errorMessage = "Unknown error";
        if (errorElement.isJsonObject()) {
            JsonObject error = errorElement.getAsJsonObject();
            if (error.has(MESSAGE)) errorMessage = error.get(MESSAGE).getAsString();
            if (error.has("data") && error.get("data").isJsonPrimitive()) {
                errorMessage = error.get("data").getAsString();
            }
        }
        LOG.warn("ACP error response for request id={}: {}", id, gson.toJson(errorElement));
        future.completeExceptionally(new AcpException("ACP error: " + errorMessage, null, false));
    }

    private void handleNotificationMessage(@NotNull JsonObject msg) {
        String method = msg.get(METHOD).getAsString();
        JsonObject params = msg.has(PARAMS) && msg.get(PARAMS).isJsonObject() ? msg.getAsJsonObject(PARAMS) : null;
        if (!"session/update".equals(method) || params == null || !params.has("update")
            || !params.get("update").isJsonObject()) {
            LOG.debug("Ignoring ACP notification: {}", method);
            return;
        }
        String sessionId = params.has(SESSION_ID) ? params.get(SESSION_ID).getAsString() : "";
        try {
            handler.sessionUpdate(sessionId, SessionUpdate.parse(params.getAsJsonObject("update")));
        } catch (RuntimeException e) {
            LOG.warn("Error handling session/update", e);
        }
    }

    /**
     * Route an agent-to-client request to the handler and answer it.
     */
    private void handleAgentRequest(@NotNull JsonObject msg) {
        String reqMethod = msg.get(METHOD).getAsString();
        JsonElement reqId = msg.get(ID);
        JsonObject params = msg.has(PARAMS) && msg.get(PARAMS).isJsonObject() ? msg.getAsJsonObject(PARAMS) : new JsonObject();
        LOG.info("ACP agent request: {} id={}", reqMethod, reqId);

        JsonObject result;
        try {
            switch (reqMethod) {
                case "session/request_permission":
                    result = handler.requestPermission(params);
                    break;
                case "fs/read_text_file":
                    result = handler.readTextFile(params);
                    break;
                case "fs/write_text_file":
                    result = handler.writeTextFile(params);
                    break;
                default:
                    sendErrorResponse(reqId, METHOD_NOT_FOUND, "Method not supported: " + reqMethod);
                    return;
            }
        } catch (RuntimeException e) {
            LOG.warn("Error handling ACP agent request {}", reqMethod, e);
            sendErrorResponse(reqId, INTERNAL_ERROR, "Internal error: " + e.getMessage());
            return;
        }
        sendResult(reqId, result);
    }

    private void sendResult(@NotNull JsonElement reqId, @NotNull JsonObject result) {
        JsonObject response = new JsonObject();
        response.addProperty(JSONRPC, "2.0");
        response.add(ID, reqId);
        response.add(RESULT, result);
        sendRawMessage(response);
    }

    private void sendErrorResponse(@NotNull JsonElement reqId, int code, @Nullable String message) {
        JsonObject response = new JsonObject();
        response.addProperty(JSONRPC, "2.0");
        response.add(ID, reqId);
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty(MESSAGE, message);
        response.add(ERROR, error);
        sendRawMessage(response);
    }

    /**
     * Stop reading and fail every pending request. Idempotent.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            LOG.debug("Failed to close ACP writer", e);
        }
        failAllPendingRequests("ACP connection closed");
        if (readerThread != null) {
            readerThread.interrupt();
        }
    }
}
