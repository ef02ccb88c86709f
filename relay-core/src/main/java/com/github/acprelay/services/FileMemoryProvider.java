package com.github.acprelay.services;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Memory kept in {@code MEMORY.md} under the relay home. Each prompt points the agent at the file,
 * and the first prompt after a restart also carries any context queued while no session was live.
 * That context goes back on the queue if the prompt carrying it is not delivered.
 */
public class FileMemoryProvider implements MemoryProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FileMemoryProvider.class);
    public static final String FILE_NAME = "MEMORY.md";
    private static final String INITIAL_CONTENT = "# Agent Memory\n\n";

    private final Path memoryFile;
    private final ContextFallbackQueue contextQueue;
    private final Object inFlightLock = new Object();
    private List<ContextQueueEntry> inFlight = List.of();

    public FileMemoryProvider(@NotNull Path home, @NotNull ContextFallbackQueue contextQueue) {
        this.memoryFile = home.resolve(FILE_NAME);
        this.contextQueue = contextQueue;
    }

    @NotNull
    public Path getMemoryFile() {
        return memoryFile;
    }

    @Override
    public void ensureMemoryFile() {
        if (Files.exists(memoryFile)) return;
        try {
            Files.createDirectories(memoryFile.getParent());
            Files.writeString(memoryFile, INITIAL_CONTENT, StandardCharsets.UTF_8);
            LOG.info("Created memory file {}", memoryFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create memory file " + memoryFile, e);
        }
    }

    @NotNull
    @Override
    public String buildPromptWithMemory(@NotNull String userPrompt) {
        StringBuilder prompt = new StringBuilder()
            .append("[Memory file: ").append(memoryFile.toAbsolutePath()).append("]\n\n");
        List<ContextQueueEntry> drained = contextQueue.loadAndClear();
        synchronized (inFlightLock) {
            inFlight = drained;
        }
        String pending = ContextFallbackQueue.formatForPrompt(drained);
        if (!pending.isEmpty()) {
            prompt.append(pending).append("\n\n");
        }
        return prompt.append(userPrompt).toString();
    }

    @Override
    public void onPromptFinished(boolean delivered) {
        List<ContextQueueEntry> entries;
        synchronized (inFlightLock) {
            entries = inFlight;
            inFlight = List.of();
        }
        if (delivered || entries.isEmpty()) return;
        for (ContextQueueEntry entry : entries) {
            contextQueue.append(entry);
        }
        LOG.info("Prompt not delivered, re-queued {} context entries", entries.size());
    }
}
