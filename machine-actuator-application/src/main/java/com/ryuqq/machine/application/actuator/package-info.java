/**
 * Actuator facade.
 *
 * <p>{@link com.ryuqq.machine.application.actuator.Actuator} is the contract the host
 * reconciliation controller calls; {@link com.ryuqq.machine.application.actuator.MachineActuator}
 * orchestrates scope acquisition, reconciler invocation, error classification, event emission
 * and the single commit per verb.</p>
 *
 * <h2>Commit Rules</h2>
 * <ul>
 *   <li>create/update: commit once after a successful reconcile, event first</li>
 *   <li>exists: never commits</li>
 *   <li>delete: never commits</li>
 *   <li>any failure before the commit discards the working copy</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.application.actuator;
