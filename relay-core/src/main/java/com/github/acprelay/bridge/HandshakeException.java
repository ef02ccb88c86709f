package com.github.acprelay.bridge;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code initialize} / {@code session/new} handshake failed. Carries the agent's recent
 * stderr output and, for well-known failure patterns, a hint for the operator.
 */
public class HandshakeException extends AcpException {
    private final String stderrTail;
    private final String hint;

    public HandshakeException(@NotNull String message, @Nullable Throwable cause,
                              @NotNull String stderrTail, @Nullable String hint) {
        super(hint != null ? message + ". " + hint : message, cause, false);
        this.stderrTail = stderrTail;
        this.hint = hint;
    }

    @NotNull
    public String getStderrTail() {
        return stderrTail;
    }

    @Nullable
    public String getHint() {
        return hint;
    }
}
