package com.github.acprelay.messaging;

import com.github.acprelay.bridge.AcpRuntimeManager;
import com.github.acprelay.services.ContextFallbackQueue;
import com.github.acprelay.services.ContextQueueEntry;
import com.github.acprelay.services.FileMemoryProvider;
import com.github.acprelay.services.JsonFileContextQueue;
import com.github.acprelay.services.RelaySettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for chat adapters: routes control commands to the runtime and queues everything else.
 */
public class AgentRelay implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentRelay.class);

    static final String NO_ACTIVE_ACTION = "No active agent action to abort.";
    static final String ABORT_REQUESTED = "⏹️ Abort requested. Stopping current agent action...";
    static final String AGENT_SHUT_DOWN = "🛑 Agent shut down. It will restart on the next message.";
    static final String ACTION_STOPPED = "Agent action stopped.";

    private final AcpRuntimeManager runtime;
    private final MessageQueue<MessageContext> queue;
    private final ContextFallbackQueue contextQueue;
    private final MessageProcessor processor;

    public AgentRelay(@NotNull AcpRuntimeManager runtime, @NotNull MessageQueue<MessageContext> queue,
                      @NotNull ContextFallbackQueue contextQueue) {
        this(runtime, queue, contextQueue, null);
    }

    private AgentRelay(@NotNull AcpRuntimeManager runtime, @NotNull MessageQueue<MessageContext> queue,
                       @NotNull ContextFallbackQueue contextQueue, @Nullable MessageProcessor processor) {
        this.runtime = runtime;
        this.queue = queue;
        this.contextQueue = contextQueue;
        this.processor = processor;
    }

    /**
     * Wire a relay from settings: file-backed memory and context queue under the relay home,
     * the configured CLI agent, and a prewarmed session.
     */
    @NotNull
    public static AgentRelay create(@NotNull RelaySettings settings, @Nullable ConversationListener listener) {
        JsonFileContextQueue contextQueue = new JsonFileContextQueue(settings.getHome());
        FileMemoryProvider memory = new FileMemoryProvider(settings.getHome(), contextQueue);
        AcpRuntimeManager runtime = new AcpRuntimeManager(settings.createCliAgent(), settings, memory);
        MessageProcessor processor = new MessageProcessor(runtime, settings, listener);
        AgentRelay relay = new AgentRelay(runtime, new MessageQueue<>(processor), contextQueue, processor);
        runtime.scheduleAcpPrewarm("startup");
        return relay;
    }

    /**
     * Handle one inbound message.
     *
     * @return completes once the message has been answered (or the command acknowledged)
     */
    @NotNull
    public CompletableFuture<Void> onMessage(@NotNull MessageContext context) {
        String text = context.text();
        if (CommandText.isAbortCommand(text)) {
            handleAbort(context);
            return CompletableFuture.completedFuture(null);
        }
        if (CommandText.isShutdownCommand(text)) {
            LOG.info("Shutdown command received (chatId={})", context.chatId());
            runtime.shutdown("user-shutdown");
            reply(context, AGENT_SHUT_DOWN);
            return CompletableFuture.completedFuture(null);
        }

        return queue.enqueue(context).exceptionally(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            if (message.toLowerCase(Locale.ROOT).contains("aborted by user")) {
                reply(context, ACTION_STOPPED);
            } else {
                reply(context, "Error: " + message);
            }
            return null;
        });
    }

    private void handleAbort(@NotNull MessageContext context) {
        if (!runtime.hasActivePrompt()) {
            reply(context, NO_ACTIVE_ACTION);
            return;
        }
        LOG.info("Abort requested (chatId={})", context.chatId());
        runtime.requestManualAbort();
        reply(context, ABORT_REQUESTED);
        runtime.cancelActivePrompt();
    }

    /**
     * Hand a background job's result to the agent, or keep it for the next prompt when no session can take it.
     */
    public void deliverBackgroundResult(@NotNull String jobId, @NotNull String text) {
        if (runtime.appendContext(text)) return;
        LOG.info("No live session for background result, queueing (jobId={})", jobId);
        contextQueue.append(ContextQueueEntry.asyncJob(jobId, text));
    }

    public int getQueueLength() {
        return queue.getQueueLength();
    }

    private static void reply(@NotNull MessageContext context, @NotNull String text) {
        try {
            context.sendText(text);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to send reply (chatId={}): {}", context.chatId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        queue.close();
        if (processor != null) processor.close();
        runtime.close();
    }
}
