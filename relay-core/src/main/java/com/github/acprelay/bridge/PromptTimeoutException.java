package com.github.acprelay.bridge;

/**
 * The overall prompt deadline elapsed.
 */
public class PromptTimeoutException extends AcpException {

    public PromptTimeoutException(String message) {
        super(message, null, true);
    }
}
