package com.ryuqq.machine.testkit.contract;

import com.ryuqq.machine.application.actuator.Verb;
import com.ryuqq.machine.core.model.Machine;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.outcome.Outcome;
import com.ryuqq.machine.core.spi.EventSeverity;
import com.ryuqq.machine.core.spi.LifecycleEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: repeated verbs on a converged machine.
 *
 * <p>A second Create on a machine already in the desired state succeeds, provisions nothing
 * and, because the working copy is unchanged, writes nothing.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class IdempotencyContractTest extends AbstractActuatorContractTest {

    @Test
    void testCreateTwice_SecondCallHasNoSideEffectsBeyondEvent() {
        // Given
        MachineName m1 = seedMachine("m1");

        // When
        Outcome first = actuator.create(context, m1);
        Machine afterFirst = storedMachine(m1);
        Outcome second = actuator.create(context, m1);

        // Then
        assertTrue(first.isOk());
        assertTrue(second.isOk());
        assertEquals(1, reconciler.getProvisionCount(), "Instance must be provisioned once");
        assertEquals(2, reconciler.invocations(Verb.CREATE));
        assertWriteCount(1);
        assertEquals(afterFirst, storedMachine(m1), "Second create must not bump the version");

        List<LifecycleEvent> events = eventRecorder.getEvents(m1);
        assertEquals(2, events.size(), "One event per invocation");
        assertTrue(events.stream().allMatch(e -> e.severity() == EventSeverity.NORMAL && e.action().equals("Create")));
    }

    @Test
    void testUpdateTwice_SecondCallWritesNothing() {
        // Given
        MachineName m1 = seedMachine("m1");
        reconciler.provision(m1);

        // When
        actuator.update(context, m1);
        Outcome second = actuator.update(context, m1);

        // Then
        assertTrue(second.isOk());
        assertWriteCount(1);
    }
}
