package com.ryuqq.machine.core.exception;

import com.ryuqq.machine.core.outcome.MachineErrorReason;

import java.util.Optional;

/**
 * 프로바이더 비즈니스 로직 실패.
 *
 * <p>Reconciler 구현이 사용하는 예외입니다. 메시지는 이 계층에서 해석하지 않고
 * Machine 오류의 메시지로 그대로 전달됩니다.</p>
 *
 * <p>재시도로 해결되지 않는 실패(잘못된 설정, 지원하지 않는 변경, 자원 부족)는
 * {@link MachineErrorReason}을 함께 담아 던질 수 있습니다. 분류가 없으면
 * 동사의 기본 분류(CreateError 등)가 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReconcileException extends RuntimeException {

    private final MachineErrorReason reason;

    public ReconcileException(String message) {
        super(message);
        this.reason = null;
    }

    public ReconcileException(String message, Throwable cause) {
        super(message, cause);
        this.reason = null;
    }

    /**
     * 분류가 지정된 실패.
     *
     * @param reason Machine 오류 분류
     * @param message 상세 메시지
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public ReconcileException(MachineErrorReason reason, String message) {
        super(message);
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        this.reason = reason;
    }

    /**
     * Reconciler가 지정한 분류 조회.
     *
     * @return 분류 (지정하지 않았으면 empty)
     */
    public Optional<MachineErrorReason> getReason() {
        return Optional.ofNullable(reason);
    }
}
