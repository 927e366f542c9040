package com.ryuqq.machine.core.outcome;

/**
 * Machine 오류의 안정적인 분류.
 *
 * <p>{@link #getValue()}는 경고 이벤트 메시지와 로그에 그대로 노출되므로 변경하면 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MachineErrorReason {

    /**
     * Create 동사 실패.
     */
    CREATE_ERROR("CreateError"),

    /**
     * Update 동사 실패.
     */
    UPDATE_ERROR("UpdateError"),

    /**
     * Delete 동사 실패.
     */
    DELETE_ERROR("DeleteError"),

    /**
     * Exists 동사 실패.
     */
    EXISTS_ERROR("ExistsError"),

    /**
     * 잘못된 Machine 설정 (재시도해도 성공할 수 없음). Reconciler가 지정합니다.
     */
    INVALID_CONFIGURATION("InvalidConfiguration"),

    /**
     * 지원하지 않는 spec 변경. Reconciler가 지정합니다.
     */
    UNSUPPORTED_CHANGE("UnsupportedChange"),

    /**
     * 프로바이더 자원 부족. Reconciler가 지정합니다.
     */
    INSUFFICIENT_RESOURCES("InsufficientResources");

    private final String value;

    MachineErrorReason(String value) {
        this.value = value;
    }

    /**
     * 분류 텍스트 조회.
     *
     * @return 분류 텍스트 (예: CreateError)
     */
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
