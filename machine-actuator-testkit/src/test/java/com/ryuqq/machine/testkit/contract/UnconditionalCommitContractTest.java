package com.ryuqq.machine.testkit.contract;

import com.ryuqq.machine.application.actuator.ActuatorConfig;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.outcome.ExistsOutcome;
import com.ryuqq.machine.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: with skipUnmodifiedCommit disabled every Create/Update commits,
 * and correctness still rests on the version token.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class UnconditionalCommitContractTest extends AbstractActuatorContractTest {

    @Override
    protected ActuatorConfig config() {
        return new ActuatorConfig().withSkipUnmodifiedCommit(false);
    }

    @Test
    void testCreateTwice_CommitsEachTimeAndStillSucceeds() {
        // Given
        MachineName m1 = seedMachine("m1");

        // When
        Outcome first = actuator.create(context, m1);
        Outcome second = actuator.create(context, m1);

        // Then
        assertTrue(first.isOk());
        assertTrue(second.isOk());
        assertWriteCount(2);
        assertEquals(1, reconciler.getProvisionCount());
    }

    @Test
    void testExists_StillNeverCommits() {
        // Given
        MachineName m1 = seedMachine("m1");
        reconciler.provision(m1);

        // When
        ExistsOutcome existence = actuator.exists(context, m1);

        // Then
        assertFalse(existence.isFail());
        assertWriteCount(0);
    }
}
