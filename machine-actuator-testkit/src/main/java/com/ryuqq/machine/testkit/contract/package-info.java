/**
 * Contract-test infrastructure for actuator implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.machine.testkit.contract.AbstractActuatorContractTest} - fixtures and assertions</li>
 *   <li>{@link com.ryuqq.machine.testkit.contract.ScriptedReconciler} - idempotent reconciler over a fake provider</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.testkit.contract;
