/**
 * Machine resource model.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.machine.core.model.MachineName} - Stable machine identifier</li>
 *   <li>{@link com.ryuqq.machine.core.model.ResourceVersion} - Opaque optimistic-concurrency token</li>
 *   <li>{@link com.ryuqq.machine.core.model.ClusterRef} - Owning cluster reference</li>
 * </ul>
 *
 * <h2>Resource</h2>
 * <ul>
 *   <li>{@link com.ryuqq.machine.core.model.Machine} - Immutable snapshot (name, spec, status, version)</li>
 *   <li>{@link com.ryuqq.machine.core.model.MachineSpec} - Desired state, owner-writable</li>
 *   <li>{@link com.ryuqq.machine.core.model.MachineStatus} - Observed state, reconciler-writable</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> mutation produces a new instance; only the store assigns versions</li>
 *   <li><strong>Validation:</strong> constructor validation ensures data integrity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.core.model;
