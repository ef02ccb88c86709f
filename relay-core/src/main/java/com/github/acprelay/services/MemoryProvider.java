package com.github.acprelay.services;

import org.jetbrains.annotations.NotNull;

/**
 * Supplies the agent's long-lived memory to each prompt.
 */
public interface MemoryProvider {

    /**
     * Wrap the user's text with whatever memory context the agent should see.
     */
    @NotNull
    String buildPromptWithMemory(@NotNull String userPrompt);

    /**
     * Make sure the backing memory store exists. Called before every session check.
     */
    void ensureMemoryFile();

    /**
     * Called once the prompt built by {@link #buildPromptWithMemory(String)} has finished.
     *
     * @param delivered {@code false} when the prompt failed, timed out or was interrupted
     */
    default void onPromptFinished(boolean delivered) {
    }

    /** A provider that adds nothing. */
    static MemoryProvider passthrough() {
        return new MemoryProvider() {
            @NotNull
            @Override
            public String buildPromptWithMemory(@NotNull String userPrompt) {
                return userPrompt;
            }

            @Override
            public void ensureMemoryFile() {
                // nothing to create
            }
        };
    }
}
