package com.ryuqq.machine.core.spi;

/**
 * 라이프사이클 이벤트 심각도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventSeverity {

    /**
     * 정상 (동사 성공).
     */
    NORMAL,

    /**
     * 경고 (동사 실패).
     */
    WARNING
}
