package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;

/**
 * Notified after a message has been answered successfully.
 */
@FunctionalInterface
public interface ConversationListener {

    void onConversationComplete(@NotNull String userMessage, @NotNull String response, @NotNull String chatId);
}
