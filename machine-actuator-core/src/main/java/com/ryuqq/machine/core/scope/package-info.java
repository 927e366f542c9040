/**
 * Single-shot bridge between an in-memory working copy and the backing store.
 *
 * <p>{@link com.ryuqq.machine.core.scope.MachineScope} is created fresh for every verb
 * invocation and writes back at most once, through compare-and-swap on the version token
 * captured at acquisition.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.core.scope;
