package com.ryuqq.classdrop.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.classdrop.core.statemachine.JobState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 작업 정상 전이 ==========

    @Test
    void validate_PendingToActive_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, ACTIVE));
    }

    @Test
    void validate_PendingToCancelled_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, CANCELLED));
    }

    @Test
    void transition_NormalFlowToSucceeded_Succeeds() {
        JobState state = PENDING;

        state = StateTransition.transition(state, ACTIVE);
        state = StateTransition.transition(state, SUCCEEDED);

        assertEquals(SUCCEEDED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 작업 불법 전이 ==========

    @Test
    void validate_PendingToSucceeded_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PENDING, SUCCEEDED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_ActiveToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(ACTIVE, PENDING));
    }

    @Test
    void validate_FromTerminal_ThrowsException() {
        for (JobState terminal : new JobState[]{SUCCEEDED, FAILED, CANCELLED}) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StateTransition.validate(terminal, ACTIVE)
            );
            assertTrue(exception.getMessage().contains("terminal"));
        }
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, ACTIVE));
    }

    // ========== 배치 전이 ==========

    @Test
    void batch_IdleToRunningToCompleted_Succeeds() {
        BatchState state = BatchState.IDLE;

        state = StateTransition.transition(state, BatchState.RUNNING);
        state = StateTransition.transition(state, BatchState.COMPLETED);

        assertEquals(BatchState.COMPLETED, state);
    }

    @Test
    void batch_CompletedToRunning_새_배치_시작은_허용된다() {
        assertDoesNotThrow(() -> StateTransition.validate(BatchState.COMPLETED, BatchState.RUNNING));
        assertDoesNotThrow(() -> StateTransition.validate(BatchState.CANCELLED, BatchState.RUNNING));
    }

    @Test
    void batch_IdleToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(BatchState.IDLE, BatchState.COMPLETED));
    }

    @Test
    void batch_RunningToIdle_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(BatchState.RUNNING, BatchState.IDLE));
    }
}
