package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO queue processed by a single drain loop, one item at a time.
 *
 * @param <T> queued item type
 */
public class MessageQueue<T> implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(MessageQueue.class);

    /**
     * Handles one item. Any exception fails that item only.
     */
    @FunctionalInterface
    public interface ItemProcessor<T> {
        void process(@NotNull T item, long requestId) throws Exception;
    }

    private record Entry<T>(long requestId, T item, CompletableFuture<Void> completion) {
    }

    private final ItemProcessor<T> processor;
    private final Queue<Entry<T>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();
    private final Object enqueueLock = new Object();
    private final ExecutorService worker;

    public MessageQueue(@NotNull ItemProcessor<T> processor) {
        this.processor = processor;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "relay-message-queue");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue an item.
     *
     * @return completes when the item has been processed, or exceptionally with {@link ItemProcessingException}
     */
    @NotNull
    public CompletableFuture<Void> enqueue(@NotNull T item) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        long requestId;
        // Id order and queue order must agree.
        synchronized (enqueueLock) {
            requestId = sequence.incrementAndGet();
            queue.add(new Entry<>(requestId, item, completion));
        }

        int queueLength = queue.size();
        if (queueLength > 1) {
            LOG.info("Message enqueued (requestId={}, queueLength={})", requestId, queueLength);
        }
        scheduleDrain();
        return completion;
    }

    public int getQueueLength() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (!processing.compareAndSet(false, true)) return;
        try {
            worker.execute(this::drain);
        } catch (RejectedExecutionException e) {
            processing.set(false);
            LOG.error("Queue processor failed: worker is shut down");
            Entry<T> entry;
            while ((entry = queue.poll()) != null) {
                entry.completion().completeExceptionally(new ItemProcessingException(entry.requestId(), e));
            }
        }
    }

    private void drain() {
        do {
            Entry<T> entry;
            while ((entry = queue.poll()) != null) {
                try {
                    processor.process(entry.item(), entry.requestId());
                    entry.completion().complete(null);
                } catch (Exception e) {
                    LOG.info("Message processing failed (requestId={}, error={})", entry.requestId(), e.getMessage());
                    entry.completion().completeExceptionally(new ItemProcessingException(entry.requestId(), e));
                }
            }
            processing.set(false);
            // An item may have arrived between the last poll and releasing the flag.
        } while (!queue.isEmpty() && processing.compareAndSet(false, true));
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
