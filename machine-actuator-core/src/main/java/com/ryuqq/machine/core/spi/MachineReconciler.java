package com.ryuqq.machine.core.spi;

import com.ryuqq.machine.core.scope.MachineScope;

/**
 * Provider reconciliation SPI.
 *
 * <p>Implementations hold the cloud-provider business rules. They receive a fresh
 * {@link MachineScope} per call and report back only by mutating it; no verb returns
 * a resource. Failures are signalled with unchecked exceptions, usually
 * {@link com.ryuqq.machine.core.exception.ReconcileException}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Idempotent: the host may re-invoke create/update after a transient failure</li>
 *   <li>A machine already in the desired state is a success, not an error</li>
 *   <li>Never call {@link MachineScope#close()}: committing belongs to the actuator</li>
 *   <li>Stateless across calls, or thread-safe: calls for distinct machines run concurrently</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MachineReconciler {

    /**
     * Provisions the machine at the provider.
     *
     * @param scope working copy of the machine
     */
    void create(MachineScope scope);

    /**
     * Brings the provider instance in line with the machine spec.
     *
     * @param scope working copy of the machine
     */
    void update(MachineScope scope);

    /**
     * Releases the provider instance and removes the machine from the store.
     *
     * @param scope working copy of the machine
     */
    void delete(MachineScope scope);

    /**
     * Checks whether the provider instance exists.
     *
     * <p>May update the working copy; those changes are never persisted.</p>
     *
     * @param scope working copy of the machine
     * @return true if the instance exists
     */
    boolean exists(MachineScope scope);
}
