package com.github.acprelay.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ContextFallbackQueue} kept as a JSON array in {@code context-queue.json}.
 */
public class JsonFileContextQueue implements ContextFallbackQueue {
    private static final Logger LOG = LoggerFactory.getLogger(JsonFileContextQueue.class);
    public static final String FILE_NAME = "context-queue.json";
    private static final Type ENTRY_LIST = new TypeToken<List<ContextQueueEntry>>() {
    }.getType();

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Path file;

    public JsonFileContextQueue(@NotNull Path home) {
        this.file = home.resolve(FILE_NAME);
    }

    @NotNull
    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void append(@NotNull ContextQueueEntry entry) {
        try {
            List<ContextQueueEntry> queue = new ArrayList<>();
            if (Files.exists(file)) {
                try {
                    queue.addAll(read());
                } catch (JsonParseException e) {
                    LOG.warn("Context queue file is corrupt, starting a new one: {}", e.getMessage());
                }
            }
            queue.add(entry);
            write(queue);
            LOG.info("Added to context queue (entryId={}, queueLength={})", entry.id(), queue.size());
        } catch (IOException e) {
            LOG.warn("Failed to append to context queue: {}", e.getMessage());
        }
    }

    @NotNull
    @Override
    public synchronized List<ContextQueueEntry> loadAndClear() {
        if (!Files.exists(file)) return List.of();
        try {
            List<ContextQueueEntry> queue = read();
            write(List.of());
            LOG.info("Loaded context queue (count={})", queue.size());
            return queue;
        } catch (IOException | JsonParseException e) {
            LOG.warn("Failed to load context queue: {}", e.getMessage());
            return List.of();
        }
    }

    @NotNull
    private List<ContextQueueEntry> read() throws IOException {
        List<ContextQueueEntry> entries = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), ENTRY_LIST);
        return entries != null ? entries : new ArrayList<>();
    }

    private void write(@NotNull List<ContextQueueEntry> entries) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, gson.toJson(entries, ENTRY_LIST), StandardCharsets.UTF_8);
    }
}
