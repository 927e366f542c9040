/**
 * In-memory lifecycle event sink.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.adapter.inmemory.event;
