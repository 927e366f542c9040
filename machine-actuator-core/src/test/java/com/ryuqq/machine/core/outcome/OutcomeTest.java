package com.ryuqq.machine.core.outcome;

import com.ryuqq.machine.core.model.MachineName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome / ExistsOutcome sealed 계층 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OutcomeTest {

    private final MachineName name = MachineName.of("m1");
    private final MachineError error = new MachineError(MachineErrorReason.UPDATE_ERROR, "boom", FailureKind.RECONCILE);

    @Test
    void ok_IsOkNotFail() {
        Outcome outcome = Ok.of(name);

        assertTrue(outcome.isOk());
        assertFalse(outcome.isFail());
        assertNull(((Ok) outcome).message());
    }

    @Test
    void fail_IsFailForBothHierarchies() {
        Fail fail = Fail.of(error);
        Outcome outcome = fail;
        ExistsOutcome existsOutcome = fail;

        assertTrue(outcome.isFail());
        assertFalse(outcome.isOk());
        assertTrue(existsOutcome.isFail());
        assertEquals(MachineErrorReason.UPDATE_ERROR, fail.reason());
        assertEquals("boom", fail.message());
    }

    @Test
    void fail_KeepsSameErrorInstance() {
        Fail fail = Fail.of(error);

        assertSame(error, fail.error());
    }

    @Test
    void existence_IsNotFail() {
        ExistsOutcome outcome = new Existence(name, true);

        assertFalse(outcome.isFail());
        assertTrue(((Existence) outcome).exists());
    }

    @Test
    void fail_NullError_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null));
    }

    @Test
    void ok_NullMachine_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Ok(null, "x"));
    }
}
