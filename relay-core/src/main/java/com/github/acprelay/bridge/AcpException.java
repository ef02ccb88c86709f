package com.github.acprelay.bridge;

/**
 * Exception thrown when ACP runtime operations fail.
 */
public class AcpException extends Exception {
    private final boolean recoverable;

    public AcpException(String message) {
        this(message, null, true);
    }

    public AcpException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public AcpException(String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    /**
     * Whether the runtime can keep serving prompts after this error (e.g. a timeout vs. a dead process).
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
