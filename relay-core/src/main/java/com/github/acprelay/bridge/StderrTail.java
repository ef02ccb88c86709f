package com.github.acprelay.bridge;

import org.jetbrains.annotations.NotNull;

/**
 * Keeps the last {@code maxChars} characters written by the agent on stderr.
 */
final class StderrTail {
    private final int maxChars;
    private final StringBuilder buffer = new StringBuilder();

    StderrTail(int maxChars) {
        this.maxChars = Math.max(0, maxChars);
    }

    synchronized void append(@NotNull String text) {
        buffer.append(text);
        int overflow = buffer.length() - maxChars;
        if (overflow > 0) {
            buffer.delete(0, overflow);
        }
    }

    synchronized void clear() {
        buffer.setLength(0);
    }

    @NotNull
    synchronized String snapshot() {
        return buffer.toString();
    }
}
