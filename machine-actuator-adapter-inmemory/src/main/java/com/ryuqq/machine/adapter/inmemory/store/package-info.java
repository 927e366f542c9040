/**
 * In-memory machine store with atomic compare-and-swap writes.
 *
 * <p>Reference implementation of {@link com.ryuqq.machine.core.spi.MachineStore} for tests
 * and local runs.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.adapter.inmemory.store;
