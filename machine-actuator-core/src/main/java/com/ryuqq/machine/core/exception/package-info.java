/**
 * Unchecked exceptions raised by the SPIs and the scope.
 *
 * <p>None of these cross the actuator boundary: the actuator converts each into a
 * {@link com.ryuqq.machine.core.outcome.Fail}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.core.exception;
