package com.github.acprelay.bridge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AcpStateTest {

    @Test
    void testHappyPath() {
        assertTrue(AcpState.IDLE.canTransitionTo(AcpState.STARTING));
        assertTrue(AcpState.STARTING.canTransitionTo(AcpState.READY));
        assertTrue(AcpState.READY.canTransitionTo(AcpState.PROMPTING));
        assertTrue(AcpState.PROMPTING.canTransitionTo(AcpState.READY));
    }

    @Test
    void testFaultsAndRecovery() {
        assertTrue(AcpState.PROMPTING.canTransitionTo(AcpState.ERROR));
        assertTrue(AcpState.ERROR.canTransitionTo(AcpState.IDLE));
        assertTrue(AcpState.ERROR.canTransitionTo(AcpState.STARTING));
        assertTrue(AcpState.SHUTTING_DOWN.canTransitionTo(AcpState.IDLE));
    }

    @Test
    void testEveryStateCanShutDown() {
        for (AcpState state : AcpState.values()) {
            if (state != AcpState.SHUTTING_DOWN) {
                assertTrue(state.canTransitionTo(AcpState.SHUTTING_DOWN), state + " -> SHUTTING_DOWN");
            }
        }
    }

    @Test
    void testIllegalTransitions() {
        assertFalse(AcpState.IDLE.canTransitionTo(AcpState.PROMPTING));
        assertFalse(AcpState.IDLE.canTransitionTo(AcpState.READY));
        assertFalse(AcpState.READY.canTransitionTo(AcpState.STARTING));
        assertFalse(AcpState.SHUTTING_DOWN.canTransitionTo(AcpState.READY));
        assertFalse(AcpState.STARTING.canTransitionTo(AcpState.PROMPTING));
    }
}
