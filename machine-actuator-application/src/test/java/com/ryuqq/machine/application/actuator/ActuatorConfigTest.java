package com.ryuqq.machine.application.actuator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActuatorConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ActuatorConfigTest {

    @Test
    void defaultConstructor_SkipsUnmodifiedCommit() {
        ActuatorConfig config = new ActuatorConfig();

        assertTrue(config.skipUnmodifiedCommit());
    }

    @Test
    void withSkipUnmodifiedCommit_ReturnsNewInstance() {
        ActuatorConfig config = new ActuatorConfig();

        ActuatorConfig changed = config.withSkipUnmodifiedCommit(false);

        assertFalse(changed.skipUnmodifiedCommit());
        assertTrue(config.skipUnmodifiedCommit());
        assertNotSame(config, changed);
    }
}
