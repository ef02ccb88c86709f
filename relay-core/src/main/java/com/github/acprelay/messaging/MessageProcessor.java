package com.github.acprelay.messaging;

import com.github.acprelay.bridge.AcpException;
import com.github.acprelay.bridge.PromptRunner;
import com.github.acprelay.services.RelaySettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Answers one chat message: runs the prompt, streams the reply back and retries transient failures.
 */
public class MessageProcessor implements MessageQueue.ItemProcessor<MessageContext>, Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(MessageProcessor.class);

    private static final List<String> RETRIABLE_MARKERS =
        List.of("capacity", "rate limit", "timeout", "unavailable", "overload");

    private final PromptRunner promptRunner;
    private final RelaySettings settings;
    private final ConversationListener listener;
    private final ScheduledExecutorService flushScheduler;

    public MessageProcessor(@NotNull PromptRunner promptRunner, @NotNull RelaySettings settings,
                            @Nullable ConversationListener listener) {
        this.promptRunner = promptRunner;
        this.settings = settings;
        this.listener = listener;
        this.flushScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-stream-flush");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void process(@NotNull MessageContext context, long requestId) throws Exception {
        LOG.info("Starting message processing (requestId={}, chatId={})", requestId, context.chatId());
        Runnable stopTyping = context.startTyping();
        ResponseDelivery delivery = createDelivery(context, requestId);
        try {
            String fullResponse = runWithRetries(context, requestId, delivery);
            String answer = delivery.complete(fullResponse);
            notifyListener(context, requestId, answer);
        } finally {
            delivery.cancel();
            stopTyping.run();
            LOG.info("Finished message processing (requestId={}, chatId={})", requestId, context.chatId());
        }
    }

    @NotNull
    private ResponseDelivery createDelivery(@NotNull MessageContext context, long requestId) {
        if (settings.isLiveMessages() && context.supportsLiveMessages()) {
            return new LiveMessagePreview(context, requestId, settings.getMaxResponseLength(),
                settings.getStreamUpdateIntervalMs(), settings.isDebugStream(), flushScheduler);
        }
        return new StreamingMessageSender(context, requestId, settings.getMaxResponseLength(),
            settings.getStreamUpdateIntervalMs(), settings.isDebugStream(), flushScheduler);
    }

    @NotNull
    private String runWithRetries(@NotNull MessageContext context, long requestId,
                                  @NotNull ResponseDelivery delivery) throws Exception {
        int maxRetries = settings.getMaxRetries();
        long retryDelayMs = settings.getRetryDelayMs();
        for (int attempt = 0; ; attempt++) {
            if (attempt > 0) {
                delivery.reset();
            }
            try {
                return promptRunner.runPrompt(context.text(), delivery::append);
            } catch (AcpException e) {
                if (attempt >= maxRetries || !isRetriable(e.getMessage())) {
                    throw e;
                }
                long delay = retryDelayMs * (1L << attempt);
                LOG.info("Agent request failed, retrying (requestId={}, attempt={}, maxRetries={}, delayMs={}, error={})",
                    requestId, attempt + 1, maxRetries, delay, e.getMessage());
                context.sendText("⚠️ LLM rate limit issue, retrying (" + (attempt + 1) + "/" + maxRetries + ")...");
                Thread.sleep(delay);
            }
        }
    }

    static boolean isRetriable(@Nullable String errorMessage) {
        if (errorMessage == null) return false;
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        return RETRIABLE_MARKERS.stream().anyMatch(lower::contains);
    }

    private void notifyListener(@NotNull MessageContext context, long requestId, @NotNull String answer) {
        if (listener == null || answer.isEmpty()) return;
        try {
            listener.onConversationComplete(context.text(), answer, context.chatId());
        } catch (RuntimeException e) {
            LOG.info("Failed to track conversation history (requestId={}, error={})", requestId, e.getMessage());
        }
    }

    @Override
    public void close() {
        flushScheduler.shutdownNow();
    }
}
