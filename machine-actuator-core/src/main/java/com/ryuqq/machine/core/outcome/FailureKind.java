package com.ryuqq.machine.core.outcome;

/**
 * 실패가 발생한 지점에 따른 분류.
 *
 * <p>모든 종류는 Actuator 경계에서 동사별 {@link MachineError}로 감싸지며,
 * 이 계층 안에서는 어느 것도 재시도되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 리소스를 읽거나 검증할 수 없어 Scope를 만들지 못함.
     */
    SCOPE_ACQUISITION,

    /**
     * 프로바이더 비즈니스 로직 실패 (메시지는 이 계층에서 해석하지 않음).
     */
    RECONCILE,

    /**
     * close 시점의 버전 토큰 불일치.
     */
    COMMIT_CONFLICT,

    /**
     * 저장소 또는 프로바이더 연결 실패, 컨텍스트 취소 포함.
     */
    TRANSPORT
}
