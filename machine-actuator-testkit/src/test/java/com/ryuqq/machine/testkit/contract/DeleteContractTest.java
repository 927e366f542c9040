package com.ryuqq.machine.testkit.contract;

import com.ryuqq.machine.application.actuator.Verb;
import com.ryuqq.machine.core.exception.ReconcileException;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.outcome.Fail;
import com.ryuqq.machine.core.outcome.MachineErrorReason;
import com.ryuqq.machine.core.outcome.Ok;
import com.ryuqq.machine.core.outcome.Outcome;
import com.ryuqq.machine.core.spi.EventSeverity;
import com.ryuqq.machine.core.spi.LifecycleEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Delete never commits.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeleteContractTest extends AbstractActuatorContractTest {

    @Test
    void testDelete_WhenReconcilerSucceeds_RemovesMachineWithoutCommit() {
        // Given
        MachineName m4 = seedMachine("m4");
        reconciler.provision(m4);

        // When
        Outcome outcome = actuator.delete(context, m4);

        // Then
        assertEquals(new Ok(m4, "Deleted machine m4"), outcome);
        assertFalse(store.contains(m4), "Machine must be absent from the store");
        assertFalse(reconciler.hasInstance(m4), "Provider instance must be released");
        assertWriteCount(0);
        assertEquals(0, store.getConflictCount(), "No commit attempt after delete");

        LifecycleEvent event = assertSingleEvent(m4, EventSeverity.NORMAL, "Delete");
        assertEquals("Deleted machine m4", event.message());
    }

    @Test
    void testDelete_WhenReconcilerMutatedScope_StillDoesNotCommit() {
        // Given: the reconciler touches the working copy before deleting
        MachineName m4 = seedMachine("m4");
        reconciler.beforeVerb(Verb.DELETE,
                scope -> scope.setStatus(scope.status().withInstanceState("TERMINATING")));

        // When
        Outcome outcome = actuator.delete(context, m4);

        // Then
        assertTrue(outcome.isOk());
        assertWriteCount(0);
        assertEquals(0, store.getConflictCount());
    }

    @Test
    void testDelete_WhenReconcilerFails_KeepsMachineAndWarns() {
        // Given
        MachineName m4 = seedMachine("m4");
        reconciler.provision(m4);
        reconciler.failOn(Verb.DELETE, new ReconcileException("instance has deletion protection enabled"));

        // When
        Fail fail = (Fail) actuator.delete(context, m4);

        // Then
        assertEquals(MachineErrorReason.DELETE_ERROR, fail.reason());
        assertTrue(store.contains(m4));
        LifecycleEvent event = assertSingleEvent(m4, EventSeverity.WARNING, "FailedDelete");
        assertEquals("DeleteError", event.message());
    }
}
