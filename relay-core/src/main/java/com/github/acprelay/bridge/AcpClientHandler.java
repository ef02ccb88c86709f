package com.github.acprelay.bridge;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

/**
 * Client side of ACP: one method per request or notification the agent can send us.
 * Methods are invoked on the connection's reader thread.
 */
public interface AcpClientHandler {

    /** {@code session/request_permission}; returns the JSON-RPC result. */
    @NotNull
    JsonObject requestPermission(@NotNull JsonObject params);

    /** {@code session/update} notification. */
    void sessionUpdate(@NotNull String sessionId, @NotNull SessionUpdate update);

    /** {@code fs/read_text_file}; returns the JSON-RPC result. */
    @NotNull
    JsonObject readTextFile(@NotNull JsonObject params);

    /** {@code fs/write_text_file}; returns the JSON-RPC result. */
    @NotNull
    JsonObject writeTextFile(@NotNull JsonObject params);
}
