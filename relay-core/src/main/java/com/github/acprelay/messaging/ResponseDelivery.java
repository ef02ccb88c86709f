package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * Turns a streamed agent reply into chat messages.
 */
public interface ResponseDelivery {

    /** Buffer one fragment; delivery happens on the engine's own schedule. */
    void append(@NotNull String chunk);

    /** Forget everything buffered or sent, before a retry. */
    void reset();

    /**
     * Deliver whatever the stream has not yet delivered.
     *
     * @param fullResponse the reply returned by the prompt
     * @return the text that now stands as the answer in the chat, empty if none
     */
    @NotNull
    String complete(@NotNull String fullResponse) throws IOException;

    /** Stop pending flushes. Called once processing ends, successful or not. */
    void cancel();
}
