package com.ryuqq.machine.core.exception;

/**
 * 백업 저장소 접근 실패 (전송 오류).
 *
 * <p>저장소 구현은 연결, 인증, 직렬화 오류를 이 예외로 감싸서 던집니다.
 * 더 구체적인 경우는 하위 클래스를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MachineStoreException extends RuntimeException {

    public MachineStoreException(String message) {
        super(message);
    }

    public MachineStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
