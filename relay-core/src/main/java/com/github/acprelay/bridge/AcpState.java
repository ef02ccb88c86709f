package com.github.acprelay.bridge;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of the single agent session owned by {@link AcpRuntimeManager}.
 */
public enum AcpState {
    /** No process, no session. */
    IDLE,
    /** Process spawn and handshake in flight. */
    STARTING,
    /** Session established, no prompt in flight. */
    READY,
    /** Exactly one prompt in flight. */
    PROMPTING,
    /** Handshake or process failed; waiting for the next ensureSession. */
    ERROR,
    /** Teardown in progress. */
    SHUTTING_DOWN;

    public boolean canTransitionTo(AcpState target) {
        return allowedTargets().contains(target);
    }

    private Set<AcpState> allowedTargets() {
        switch (this) {
            case IDLE:
                return EnumSet.of(STARTING, SHUTTING_DOWN);
            case STARTING:
                return EnumSet.of(READY, ERROR, IDLE, SHUTTING_DOWN);
            case READY:
                return EnumSet.of(PROMPTING, ERROR, SHUTTING_DOWN);
            case PROMPTING:
                return EnumSet.of(READY, ERROR, SHUTTING_DOWN);
            case ERROR:
                return EnumSet.of(STARTING, IDLE, SHUTTING_DOWN);
            case SHUTTING_DOWN:
                return EnumSet.of(IDLE);
            default:
                return EnumSet.noneOf(AcpState.class);
        }
    }
}
