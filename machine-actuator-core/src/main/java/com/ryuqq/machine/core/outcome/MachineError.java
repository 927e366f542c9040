package com.ryuqq.machine.core.outcome;

/**
 * 동사별 실패 경로에서 만들어지는 타입이 있는 Machine 오류.
 *
 * <p>실패 지점에서 한 번 생성되고, 오류 핸들러(이벤트 + 로그)가 한 번 소비한 뒤
 * 호출자에게 그대로 반환됩니다. 생성 후에는 변경되지 않습니다.</p>
 *
 * @param reason 안정적인 분류
 * @param message 사람이 읽을 수 있는 상세 메시지
 * @param kind 실패 지점 분류
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MachineError(
    MachineErrorReason reason,
    String message,
    FailureKind kind
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null이거나 message가 빈 문자열인 경우
     */
    public MachineError {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    @Override
    public String toString() {
        return reason.getValue() + ": " + message;
    }
}
