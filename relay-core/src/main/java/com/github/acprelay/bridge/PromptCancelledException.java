package com.github.acprelay.bridge;

/**
 * The agent answered a prompt with stop reason {@code cancelled} and no output.
 */
public class PromptCancelledException extends AcpException {
    private final boolean manualAbort;

    public PromptCancelledException(String message, boolean manualAbort) {
        super(message, null, true);
        this.manualAbort = manualAbort;
    }

    /** True when the user asked for the abort, false when the agent cancelled on its own. */
    public boolean isManualAbort() {
        return manualAbort;
    }
}
