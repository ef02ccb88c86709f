package com.github.acprelay.bridge;

/**
 * The agent executable could not be started.
 */
public class ProcessSpawnException extends AcpException {

    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
