package com.github.acprelay.services;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Durable store for context that could not be injected into a live session.
 */
public interface ContextFallbackQueue {

    void append(@NotNull ContextQueueEntry entry);

    /**
     * Return all pending entries and empty the store.
     */
    @NotNull
    List<ContextQueueEntry> loadAndClear();

    /**
     * Render entries as a prompt prefix, or an empty string when there are none.
     */
    @NotNull
    static String formatForPrompt(@NotNull List<ContextQueueEntry> entries) {
        if (entries.isEmpty()) return "";
        String formatted = entries.stream()
            .map(entry -> ContextQueueEntry.SOURCE_ASYNC_JOB.equals(entry.source())
                ? "[Background Job " + entry.id() + "] " + entry.content()
                : entry.content())
            .collect(Collectors.joining("\n\n"));
        return "Pending context from recent background jobs:\n" + formatted;
    }
}
