/**
 * Service Provider Interfaces of the actuator.
 *
 * <ul>
 *   <li>{@link com.ryuqq.machine.core.spi.MachineStore} - Backing store with compare-and-swap writes</li>
 *   <li>{@link com.ryuqq.machine.core.spi.MachineReconciler} - Provider business logic, four verbs</li>
 *   <li>{@link com.ryuqq.machine.core.spi.EventRecorder} - Lifecycle event sink</li>
 *   <li>{@link com.ryuqq.machine.core.spi.MachineValidator} - Resource validation at scope acquisition</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.core.spi;
