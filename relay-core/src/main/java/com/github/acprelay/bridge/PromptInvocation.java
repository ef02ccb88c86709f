package com.github.acprelay.bridge;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * State of one {@code runPrompt} call. Settles exactly once; everything that arrives afterwards
 * (late chunks, late timers, late responses) is dropped.
 */
final class PromptInvocation {
    private final String id;
    private final long startedAt = System.currentTimeMillis();
    private final Consumer<String> onChunk;
    private final StringBuilder response = new StringBuilder();
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private long firstChunkAt = -1;
    private int chunkCount;
    private ScheduledFuture<?> overallTimer;
    private ScheduledFuture<?> noOutputTimer;
    private CompletableFuture<JsonObject> pendingRequest;

    PromptInvocation(@NotNull String id, @Nullable Consumer<String> onChunk) {
        this.id = id;
        this.onChunk = onChunk;
    }

    @NotNull
    String getId() {
        return id;
    }

    @Nullable
    Consumer<String> getOnChunk() {
        return onChunk;
    }

    @NotNull
    CompletableFuture<String> getResult() {
        return result;
    }

    /**
     * Record a text fragment; false once the invocation has settled.
     */
    synchronized boolean append(@NotNull String text) {
        if (settled.get()) return false;
        chunkCount++;
        if (firstChunkAt < 0) firstChunkAt = System.currentTimeMillis();
        response.append(text);
        return true;
    }

    @NotNull
    synchronized String getResponseText() {
        return response.toString();
    }

    synchronized int getChunkCount() {
        return chunkCount;
    }

    synchronized int getBufferedLength() {
        return response.length();
    }

    /** Milliseconds from start to the first fragment, or -1 when none arrived. */
    synchronized long getFirstChunkDelayMs() {
        return firstChunkAt < 0 ? -1 : firstChunkAt - startedAt;
    }

    long getElapsedMs() {
        return System.currentTimeMillis() - startedAt;
    }

    boolean isSettled() {
        return settled.get();
    }

    /** Claims the single settlement; true only for the first caller. */
    boolean markSettled() {
        return settled.compareAndSet(false, true);
    }

    synchronized void setOverallTimer(@NotNull ScheduledFuture<?> timer) {
        if (settled.get()) {
            timer.cancel(false);
            return;
        }
        overallTimer = timer;
    }

    synchronized void replaceNoOutputTimer(@NotNull ScheduledFuture<?> timer) {
        if (noOutputTimer != null) noOutputTimer.cancel(false);
        if (settled.get()) {
            timer.cancel(false);
            noOutputTimer = null;
            return;
        }
        noOutputTimer = timer;
    }

    synchronized void setPendingRequest(@NotNull CompletableFuture<JsonObject> request) {
        pendingRequest = request;
    }

    /**
     * Cancel both timers and forget the outstanding protocol request.
     */
    synchronized void release() {
        if (overallTimer != null) overallTimer.cancel(false);
        if (noOutputTimer != null) noOutputTimer.cancel(false);
        overallTimer = null;
        noOutputTimer = null;
        if (pendingRequest != null && !pendingRequest.isDone()) pendingRequest.cancel(false);
        pendingRequest = null;
    }
}
