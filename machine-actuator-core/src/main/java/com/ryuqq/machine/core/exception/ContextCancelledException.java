package com.ryuqq.machine.core.exception;

/**
 * 호출 컨텍스트가 취소되었거나 마감 시간이 지남.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ContextCancelledException extends RuntimeException {

    public ContextCancelledException(String message) {
        super(message);
    }
}
