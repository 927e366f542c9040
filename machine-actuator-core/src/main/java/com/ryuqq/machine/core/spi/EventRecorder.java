package com.ryuqq.machine.core.spi;

import com.ryuqq.machine.core.model.MachineName;

/**
 * Event sink SPI.
 *
 * <p>Events are purely observational: the recorder must not throw back into the
 * caller for delivery problems and keeps no state the actuator depends on.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventRecorder {

    /**
     * Records one lifecycle event.
     *
     * @param event the event
     * @throws IllegalArgumentException if event is null
     */
    void record(LifecycleEvent event);

    /**
     * Records one lifecycle event with a message built from a format string.
     *
     * @param subject the machine the event is about
     * @param severity NORMAL or WARNING
     * @param action the event action
     * @param format {@link String#format} pattern
     * @param args format arguments
     */
    default void eventf(MachineName subject, EventSeverity severity, String action, String format, Object... args) {
        record(new LifecycleEvent(subject, severity, action, String.format(format, args)));
    }
}
