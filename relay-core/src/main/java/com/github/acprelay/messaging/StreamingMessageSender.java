package com.github.acprelay.messaging;

import com.github.acprelay.bridge.AcpRuntimeManager;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Incremental delivery: each debounced flush sends only the part of the (truncated) buffer that
 * has not been sent yet.
 */
public class StreamingMessageSender implements ResponseDelivery {
    private static final Logger LOG = LoggerFactory.getLogger(StreamingMessageSender.class);

    private final MessageContext context;
    private final long requestId;
    private final int maxResponseLength;
    private final boolean debugStream;
    private final Debouncer debouncer;

    private final Object bufferLock = new Object();
    private final Object sendLock = new Object();
    private final StringBuilder buffer = new StringBuilder();
    private int sentLength = 0;
    private volatile boolean finalized = false;

    public StreamingMessageSender(@NotNull MessageContext context, long requestId, int maxResponseLength,
                                  long streamUpdateIntervalMs, boolean debugStream,
                                  @NotNull ScheduledExecutorService scheduler) {
        this.context = context;
        this.requestId = requestId;
        this.maxResponseLength = maxResponseLength;
        this.debugStream = debugStream;
        this.debouncer = new Debouncer(scheduler, streamUpdateIntervalMs, this::sendNewContent);
    }

    @Override
    public void append(@NotNull String chunk) {
        synchronized (bufferLock) {
            buffer.append(chunk);
        }
        debouncer.trigger();
    }

    @NotNull
    public String getBuffer() {
        synchronized (bufferLock) {
            return buffer.toString();
        }
    }

    public void setBuffer(@NotNull String text) {
        synchronized (bufferLock) {
            buffer.setLength(0);
            buffer.append(text);
        }
    }

    @Override
    public void reset() {
        debouncer.cancel();
        synchronized (sendLock) {
            synchronized (bufferLock) {
                buffer.setLength(0);
            }
            sentLength = 0;
            finalized = false;
        }
    }

    private void sendNewContent() {
        synchronized (sendLock) {
            if (finalized) return;

            String text = MessageTruncator.smartTruncate(getBuffer(), maxResponseLength);
            String newContent = sentLength < text.length() ? text.substring(sentLength).trim() : "";
            if (newContent.isEmpty()) return;

            try {
                context.sendText(newContent);
                sentLength = text.length();
                if (debugStream) {
                    LOG.info("Stream chunk sent (requestId={}, chunkLength={})", requestId, newContent.length());
                }
            } catch (IOException | RuntimeException e) {
                LOG.info("Failed to send stream chunk (requestId={}, error={})", requestId, e.getMessage());
            }
        }
    }

    /**
     * Cancel any pending flush, flush once more and stop. Later calls do nothing.
     */
    public void finalizeStream(@Nullable String textOverride) {
        if (finalized) return;
        debouncer.cancel();
        if (textOverride != null && !textOverride.isEmpty()) {
            setBuffer(textOverride);
        }
        synchronized (sendLock) {
            sendNewContent();
            finalized = true;
        }
    }

    @NotNull
    @Override
    public String complete(@NotNull String fullResponse) throws IOException {
        finalizeStream(null);
        String buffered = getBuffer();
        if (!hasSentContent()) {
            String fallback = buffered.isEmpty() ? AcpRuntimeManager.NO_RESPONSE : buffered;
            for (String chunk : MessageTruncator.splitIntoSmartChunks(fallback, maxResponseLength)) {
                context.sendText(chunk);
            }
        }
        return buffered;
    }

    @Override
    public void cancel() {
        debouncer.cancel();
    }

    public boolean hasSentContent() {
        synchronized (sendLock) {
            return sentLength > 0;
        }
    }

    public boolean isFinalized() {
        return finalized;
    }
}
