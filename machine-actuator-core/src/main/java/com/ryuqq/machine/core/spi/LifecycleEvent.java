package com.ryuqq.machine.core.spi;

import com.ryuqq.machine.core.model.MachineName;

/**
 * 이벤트 싱크로 보내는 관측용 라이프사이클 이벤트.
 *
 * @param subject 대상 Machine
 * @param severity 심각도
 * @param action 동작 (예: Create, FailedCreate)
 * @param message 형식화된 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleEvent(
    MachineName subject,
    EventSeverity severity,
    String action,
    String message
) {

    public LifecycleEvent {
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}
