package com.github.acprelay.bridge;

/**
 * The agent went silent (no notifications, no stderr) for longer than the no-output window.
 */
public class PromptNoOutputTimeoutException extends PromptTimeoutException {

    public PromptNoOutputTimeoutException(String message) {
        super(message);
    }
}
