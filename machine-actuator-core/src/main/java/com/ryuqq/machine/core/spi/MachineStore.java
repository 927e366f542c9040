package com.ryuqq.machine.core.spi;

import com.ryuqq.machine.core.exception.MachineNotFoundException;
import com.ryuqq.machine.core.exception.MachineStoreException;
import com.ryuqq.machine.core.exception.VersionConflictException;
import com.ryuqq.machine.core.model.Machine;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.model.ResourceVersion;

/**
 * Backing store SPI for machine resources.
 *
 * <p>The store owns every machine. Callers hold transient copies and write them back
 * through an explicit compare-and-swap on the version token; the store never retries
 * and never merges.</p>
 *
 * <p><strong>Compare-and-swap:</strong></p>
 * <pre>
 * Machine current = store.get(name);          // version v1
 * Machine changed = current.withStatus(...);  // still v1
 * store.compareAndSwap(changed, v1);          // stored as v2, or VersionConflictException
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent calls for distinct machines must not block each other</li>
 *   <li>Atomic: the version check and the write happen as one step</li>
 *   <li>Every successful write assigns a new version token</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MachineStore {

    /**
     * Reads the current machine together with its version token.
     *
     * @param name the machine name
     * @return the stored machine
     * @throws IllegalArgumentException if name is null
     * @throws MachineNotFoundException if no machine is stored under name
     * @throws MachineStoreException on transport failure
     */
    Machine get(MachineName name);

    /**
     * Writes the machine only if the stored version still equals expectedVersion.
     *
     * <p>The version carried by {@code machine} itself is ignored; the store assigns the new one.</p>
     *
     * @param machine the machine content to store
     * @param expectedVersion the version token captured when the copy was read
     * @return the stored machine carrying its new version token
     * @throws IllegalArgumentException if an argument is null
     * @throws VersionConflictException if the stored version differs from expectedVersion
     * @throws MachineNotFoundException if the machine was removed meanwhile
     * @throws MachineStoreException on transport failure
     */
    Machine compareAndSwap(Machine machine, ResourceVersion expectedVersion);

    /**
     * Removes the machine.
     *
     * @param name the machine name
     * @return true if a machine was removed, false if none was stored
     * @throws IllegalArgumentException if name is null
     * @throws MachineStoreException on transport failure
     */
    boolean delete(MachineName name);
}
