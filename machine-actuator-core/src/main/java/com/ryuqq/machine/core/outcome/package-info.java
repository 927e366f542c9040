/**
 * Verb execution outcome package.
 *
 * <p>Errors are returned as values, never thrown across the actuator boundary.</p>
 *
 * <h2>Sealed Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.machine.core.outcome.Outcome} - Create/Update/Delete result (permits Ok, Fail)</li>
 *   <li>{@link com.ryuqq.machine.core.outcome.ExistsOutcome} - Exists result (permits Existence, Fail)</li>
 * </ul>
 *
 * <h2>Typed Error</h2>
 * <ul>
 *   <li>{@link com.ryuqq.machine.core.outcome.MachineError} - (reason, message, kind), immutable</li>
 *   <li>{@link com.ryuqq.machine.core.outcome.MachineErrorReason} - Stable classification text</li>
 *   <li>{@link com.ryuqq.machine.core.outcome.FailureKind} - Where the failure happened</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.core.outcome;
