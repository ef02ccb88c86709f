package com.github.acprelay.messaging;

/**
 * The processing function failed for one queued item. Only that item's future completes with it.
 */
public class ItemProcessingException extends RuntimeException {
    private final long requestId;

    public ItemProcessingException(long requestId, Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        this.requestId = requestId;
    }

    public long getRequestId() {
        return requestId;
    }
}
