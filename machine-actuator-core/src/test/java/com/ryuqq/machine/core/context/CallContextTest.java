package com.ryuqq.machine.core.context;

import com.ryuqq.machine.core.exception.ContextCancelledException;
import com.ryuqq.machine.core.model.ClusterRef;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallContext 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CallContextTest {

    private final CallContext context = CallContext.of(ClusterRef.of("c1"));

    @Test
    void newContext_IsActive() {
        assertFalse(context.isDone());
        assertDoesNotThrow(context::checkActive);
        assertEquals("c1", context.getCluster().name());
    }

    @Test
    void cancel_MakesCheckActiveThrow() {
        context.cancel();

        assertTrue(context.isDone());
        ContextCancelledException exception = assertThrows(ContextCancelledException.class, context::checkActive);
        assertEquals("context cancelled", exception.getMessage());
    }

    @Test
    void deadlinePassed_MakesCheckActiveThrow() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);

        CallContext expired = context.withDeadline(now, clock);

        ContextCancelledException exception = assertThrows(ContextCancelledException.class, expired::checkActive);
        assertEquals("context deadline exceeded", exception.getMessage());
    }

    @Test
    void deadlineInFuture_IsActive() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);

        CallContext withDeadline = context.withDeadline(now.plusSeconds(30), clock);

        assertFalse(withDeadline.isDone());
    }

    @Test
    void withDeadline_SharesCancellation() {
        CallContext derived = context.withDeadline(Instant.MAX, Clock.systemUTC());

        context.cancel();

        assertTrue(derived.isDone());
    }

    @Test
    void of_NullCluster_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CallContext.of(null));
    }
}
