/**
 * Per-call context (cluster reference, deadline, cancellation), passed through opaquely.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.machine.core.context;
