package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * One inbound chat message and the operations for answering it. Implemented by chat platform adapters.
 * <p>
 * Live-message operations are optional; adapters that support editing a sent message override
 * {@link #supportsLiveMessages()} and the four live-message methods.
 */
public interface MessageContext {

    @NotNull
    String chatId();

    @NotNull
    String text();

    /**
     * Show a typing indicator.
     *
     * @return stops the indicator
     */
    @NotNull
    Runnable startTyping();

    void sendText(@NotNull String text) throws IOException;

    default boolean supportsLiveMessages() {
        return false;
    }

    /**
     * @return a handle identifying the new message
     */
    @NotNull
    default Object startLiveMessage(@NotNull String initialText) throws IOException {
        throw new UnsupportedOperationException("Live messages are not supported");
    }

    default void updateLiveMessage(@NotNull Object handle, @NotNull String text) throws IOException {
        throw new UnsupportedOperationException("Live messages are not supported");
    }

    default void finalizeLiveMessage(@NotNull Object handle, @NotNull String text) throws IOException {
        throw new UnsupportedOperationException("Live messages are not supported");
    }

    default void removeMessage(@NotNull Object handle) throws IOException {
        throw new UnsupportedOperationException("Live messages are not supported");
    }
}
