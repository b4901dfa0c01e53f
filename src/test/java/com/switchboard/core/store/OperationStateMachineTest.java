package com.switchboard.core.store;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.model.OperationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static com.switchboard.core.model.OperationStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class OperationStateMachineTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "CREATED, CLASSIFIED",
            "CLASSIFIED, ROUTED",
            "CLASSIFIED, CLASSIFIED",
            "ROUTED, VERIFYING",
            "ROUTED, CLASSIFIED",
            "VERIFYING, APPROVED",
            "VERIFYING, REJECTED",
            "VERIFYING, ESCALATED",
            "VERIFYING, CLASSIFIED",
            "ESCALATED, APPROVED",
            "ESCALATED, REJECTED",
            "ESCALATED, CLASSIFIED"
    })
    @DisplayName("allowed transitions")
    void allowed(OperationStatus from, OperationStatus to) {
        assertTrue(OperationStateMachine.canTransition(from, to));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "CREATED, ROUTED",
            "CREATED, APPROVED",
            "CLASSIFIED, VERIFYING",
            "ROUTED, APPROVED",
            "ESCALATED, VERIFYING",
            "APPROVED, CLASSIFIED",
            "REJECTED, ESCALATED"
    })
    @DisplayName("forbidden transitions")
    void forbidden(OperationStatus from, OperationStatus to) {
        assertFalse(OperationStateMachine.canTransition(from, to));
    }

    @Test
    @DisplayName("terminal states allow nothing")
    void terminalStatesAreFinal() {
        assertEquals(Set.of(), OperationStateMachine.allowedFrom(APPROVED));
        assertEquals(Set.of(), OperationStateMachine.allowedFrom(REJECTED));
    }

    @Test
    @DisplayName("requireTransition raises IllegalStateTransitionException")
    void requireTransitionThrows() {
        var ex = assertThrows(IllegalStateTransitionException.class, () ->
                OperationStateMachine.requireTransition("op-1", APPROVED, CLASSIFIED));

        assertEquals(ErrorKind.ILLEGAL_STATE, ex.kind());
        assertEquals(APPROVED, ex.from());
        assertEquals(CLASSIFIED, ex.to());
        assertDoesNotThrow(() -> OperationStateMachine.requireTransition("op-1", CREATED, CLASSIFIED));
    }
}
