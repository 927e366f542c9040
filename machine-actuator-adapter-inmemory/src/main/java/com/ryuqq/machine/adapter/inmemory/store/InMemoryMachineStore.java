package com.ryuqq.machine.adapter.inmemory.store;

import com.ryuqq.machine.core.exception.MachineNotFoundException;
import com.ryuqq.machine.core.exception.MachineStoreException;
import com.ryuqq.machine.core.exception.VersionConflictException;
import com.ryuqq.machine.core.model.Machine;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.model.MachineSpec;
import com.ryuqq.machine.core.model.MachineStatus;
import com.ryuqq.machine.core.model.ResourceVersion;
import com.ryuqq.machine.core.spi.MachineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link MachineStore} SPI for testing and reference purposes.
 *
 * <p>Machines live in a {@link ConcurrentHashMap}; compare-and-swap runs inside
 * {@link ConcurrentHashMap#compute}, so the version check and the write are one atomic
 * step per key and writers of distinct machines never block each other.</p>
 *
 * <p><strong>Version Tokens:</strong> a single monotonically increasing counter shared by
 * all machines, rendered as a decimal string. Every successful write takes the next value.</p>
 *
 * <p><strong>Test Support:</strong></p>
 * <ul>
 *   <li>{@link #seed(MachineName, MachineSpec)} stores a new machine outside the CAS path</li>
 *   <li>{@link #simulateConcurrentWrite(MachineName)} bumps the version as a racing writer would</li>
 *   <li>{@link #failNextOperation(RuntimeException)} injects a one-shot transport failure</li>
 *   <li>read/write/conflict/delete counters</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMachineStore store = new InMemoryMachineStore();
 * Machine seeded = store.seed(MachineName.of("m1"), MachineSpec.of(Map.of("zone", "a")));
 *
 * Machine changed = seeded.withStatus(seeded.getStatus().withInstanceState("RUNNING"));
 * store.compareAndSwap(changed, seeded.getVersion());   // ok, new version
 * store.compareAndSwap(changed, seeded.getVersion());   // VersionConflictException
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMachineStore implements MachineStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMachineStore.class);

    private final ConcurrentHashMap<MachineName, Machine> machines;
    private final AtomicLong versionSequence;
    private final AtomicReference<RuntimeException> pendingFailure;

    private final AtomicInteger readCount;
    private final AtomicInteger writeCount;
    private final AtomicInteger conflictCount;
    private final AtomicInteger deleteCount;

    /**
     * Creates an empty store.
     */
    public InMemoryMachineStore() {
        this.machines = new ConcurrentHashMap<>();
        this.versionSequence = new AtomicLong();
        this.pendingFailure = new AtomicReference<>();
        this.readCount = new AtomicInteger();
        this.writeCount = new AtomicInteger();
        this.conflictCount = new AtomicInteger();
        this.deleteCount = new AtomicInteger();
    }

    @Override
    public Machine get(MachineName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        throwPendingFailure();
        readCount.incrementAndGet();

        Machine machine = machines.get(name);
        if (machine == null) {
            throw new MachineNotFoundException(name);
        }
        return machine;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Version check and write run inside {@code compute} for the key</li>
     *   <li>A conflict leaves the stored machine untouched</li>
     *   <li>Only successful writes are counted in {@link #getWriteCount()}</li>
     * </ul>
     */
    @Override
    public Machine compareAndSwap(Machine machine, ResourceVersion expectedVersion) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        if (expectedVersion == null) {
            throw new IllegalArgumentException("expectedVersion cannot be null");
        }
        throwPendingFailure();

        MachineName name = machine.getName();
        Machine stored = machines.compute(name, (key, existing) -> {
            if (existing == null) {
                log.debug("CAS rejected for {}: machine no longer stored", key);
                throw new MachineNotFoundException(key);
            }
            if (!existing.getVersion().equals(expectedVersion)) {
                conflictCount.incrementAndGet();
                log.debug("CAS conflict for {}: expected version {}, actual {}",
                    key, expectedVersion, existing.getVersion());
                throw new VersionConflictException(key, expectedVersion, existing.getVersion());
            }
            return machine.withVersion(nextVersion());
        });
        writeCount.incrementAndGet();
        return stored;
    }

    @Override
    public boolean delete(MachineName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        throwPendingFailure();

        boolean removed = machines.remove(name) != null;
        if (removed) {
            deleteCount.incrementAndGet();
        }
        return removed;
    }

    /**
     * Stores a new machine with an empty status, replacing any existing one.
     *
     * @param name the machine name
     * @param spec the desired state
     * @return the stored machine with its version token
     */
    public Machine seed(MachineName name, MachineSpec spec) {
        return put(Machine.of(name, spec, MachineStatus.empty(), ResourceVersion.of("0")));
    }

    /**
     * Stores the machine content unconditionally under a fresh version token.
     *
     * @param machine the machine content
     * @return the stored machine with its version token
     */
    public Machine put(Machine machine) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        Machine stored = machine.withVersion(nextVersion());
        machines.put(stored.getName(), stored);
        return stored;
    }

    /**
     * Bumps the stored version without changing content, as a concurrent writer would.
     *
     * @param name the machine name
     * @return the stored machine with its new version token
     * @throws MachineNotFoundException if no machine is stored under name
     */
    public Machine simulateConcurrentWrite(MachineName name) {
        Machine bumped = machines.computeIfPresent(name, (key, existing) -> existing.withVersion(nextVersion()));
        if (bumped == null) {
            throw new MachineNotFoundException(name);
        }
        return bumped;
    }

    /**
     * Makes the next get, compareAndSwap or delete throw the given failure once.
     *
     * @param failure the failure to throw, typically a {@link MachineStoreException}
     */
    public void failNextOperation(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        pendingFailure.set(failure);
    }

    /**
     * Looks up a machine without counting the read.
     *
     * @param name the machine name
     * @return the stored machine, or null if absent
     */
    public Machine peek(MachineName name) {
        return machines.get(name);
    }

    public boolean contains(MachineName name) {
        return machines.containsKey(name);
    }

    public int getReadCount() {
        return readCount.get();
    }

    public int getWriteCount() {
        return writeCount.get();
    }

    public int getConflictCount() {
        return conflictCount.get();
    }

    public int getDeleteCount() {
        return deleteCount.get();
    }

    /**
     * Removes every machine and resets the counters (version sequence keeps increasing).
     */
    public void clear() {
        machines.clear();
        pendingFailure.set(null);
        readCount.set(0);
        writeCount.set(0);
        conflictCount.set(0);
        deleteCount.set(0);
    }

    private ResourceVersion nextVersion() {
        return ResourceVersion.of(Long.toString(versionSequence.incrementAndGet()));
    }

    private void throwPendingFailure() {
        RuntimeException failure = pendingFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
    }
}
