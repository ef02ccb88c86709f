package com.github.acprelay.bridge;

/**
 * A prompt was started while another one is in flight or the runtime is shutting down.
 * Thrown before any state is touched.
 */
public class ConcurrentPromptException extends AcpException {

    public ConcurrentPromptException(String message) {
        super(message, null, true);
    }
}
