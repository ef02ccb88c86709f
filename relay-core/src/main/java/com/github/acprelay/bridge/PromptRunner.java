package com.github.acprelay.bridge;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Consumer;

/**
 * Runs one prompt against the agent, streaming visible text to {@code onChunk}.
 */
@FunctionalInterface
public interface PromptRunner {

    @NotNull
    String runPrompt(@NotNull String promptText, @Nullable Consumer<String> onChunk) throws AcpException;
}
