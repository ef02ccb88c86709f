package com.github.acprelay.messaging;

import com.github.acprelay.bridge.AcpRuntimeManager;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Delivery through one message that is edited as the reply grows, for adapters that support it.
 */
public class LiveMessagePreview implements ResponseDelivery {
    private static final Logger LOG = LoggerFactory.getLogger(LiveMessagePreview.class);
    private static final String PREVIEW_ELLIPSIS = "…";

    private final MessageContext context;
    private final long requestId;
    private final int maxResponseLength;
    private final boolean debugStream;
    private final Debouncer debouncer;

    private final Object lock = new Object();
    private final StringBuilder previewBuffer = new StringBuilder();
    private Object liveMessage;
    private boolean finalized = false;

    public LiveMessagePreview(@NotNull MessageContext context, long requestId, int maxResponseLength,
                              long streamUpdateIntervalMs, boolean debugStream,
                              @NotNull ScheduledExecutorService scheduler) {
        this.context = context;
        this.requestId = requestId;
        this.maxResponseLength = maxResponseLength;
        this.debugStream = debugStream;
        this.debouncer = new Debouncer(scheduler, streamUpdateIntervalMs, () -> flushPreview(true));
    }

    @Override
    public void append(@NotNull String chunk) {
        synchronized (lock) {
            previewBuffer.append(chunk);
        }
        debouncer.trigger();
    }

    @NotNull
    String previewText() {
        synchronized (lock) {
            if (previewBuffer.length() <= maxResponseLength) {
                return previewBuffer.toString();
            }
            return previewBuffer.substring(0, Math.max(0, maxResponseLength - 1)) + PREVIEW_ELLIPSIS;
        }
    }

    private void flushPreview(boolean allowStart) {
        synchronized (lock) {
            if (finalized) return;
            String text = previewText();
            if (text.isEmpty()) return;

            if (liveMessage == null) {
                if (!allowStart) return;
                try {
                    liveMessage = context.startLiveMessage(text);
                } catch (IOException | RuntimeException e) {
                    LOG.info("Could not start live message (requestId={}, error={})", requestId, e.getMessage());
                    return;
                }
            }

            try {
                context.updateLiveMessage(liveMessage, text);
                if (debugStream) {
                    LOG.info("Live preview updated (requestId={}, previewLength={})", requestId, text.length());
                }
            } catch (IOException | RuntimeException e) {
                String message = String.valueOf(e.getMessage()).toLowerCase();
                if (!message.contains("message is not modified")) {
                    LOG.info("Live preview update skipped (requestId={}, error={})", requestId, e.getMessage());
                }
            }
        }
    }

    @Override
    public void reset() {
        debouncer.cancel();
        synchronized (lock) {
            previewBuffer.setLength(0);
            if (liveMessage != null) {
                removeQuietly(liveMessage);
                liveMessage = null;
            }
            finalized = false;
        }
    }

    @NotNull
    @Override
    public String complete(@NotNull String fullResponse) throws IOException {
        debouncer.cancel();
        flushPreview(true);

        String response = fullResponse.isEmpty() ? AcpRuntimeManager.NO_RESPONSE : fullResponse;
        List<String> chunks = MessageTruncator.splitIntoSmartChunks(response, maxResponseLength);

        Object handle;
        synchronized (lock) {
            handle = liveMessage;
            finalized = true;
        }

        int next = 0;
        if (handle != null) {
            try {
                context.finalizeLiveMessage(handle, chunks.get(0));
            } catch (IOException | RuntimeException e) {
                LOG.info("Live message finalize failed; keeping streamed message as final output (requestId={}, error={})",
                    requestId, e.getMessage());
            }
            next = 1;
        }
        for (int i = next; i < chunks.size(); i++) {
            context.sendText(chunks.get(i));
        }
        return fullResponse;
    }

    @Override
    public void cancel() {
        debouncer.cancel();
        synchronized (lock) {
            if (liveMessage != null && !finalized) {
                removeQuietly(liveMessage);
                liveMessage = null;
            }
        }
    }

    private void removeQuietly(@NotNull Object handle) {
        try {
            context.removeMessage(handle);
        } catch (IOException | RuntimeException e) {
            LOG.debug("Could not remove live message (requestId={}): {}", requestId, e.getMessage());
        }
    }
}
