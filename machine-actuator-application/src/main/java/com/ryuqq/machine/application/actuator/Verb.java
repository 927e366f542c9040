package com.ryuqq.machine.application.actuator;

import com.ryuqq.machine.core.outcome.FailureKind;
import com.ryuqq.machine.core.outcome.MachineError;
import com.ryuqq.machine.core.outcome.MachineErrorReason;

/**
 * Actuator 동사별 분류, 이벤트 action, 로그/이벤트 문구.
 *
 * <p>EXISTS의 이벤트 action은 빈 문자열이며, 이 경우 이벤트를 보내지 않습니다.
 * 실패 경고 이벤트의 action은 {@code "Failed" + eventAction} (예: FailedCreate)으로 고정입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Verb {

    CREATE("Create", MachineErrorReason.CREATE_ERROR, "Creating machine", "Created Machine %s"),
    EXISTS("", MachineErrorReason.EXISTS_ERROR, "Checking if machine exists", null),
    UPDATE("Update", MachineErrorReason.UPDATE_ERROR, "Updating machine", "Updated Machine %s"),
    DELETE("Delete", MachineErrorReason.DELETE_ERROR, "Deleting machine", "Deleted machine %s");

    /**
     * 이벤트를 보내지 않는 action.
     */
    public static final String NO_EVENT_ACTION = "";

    /**
     * 실패 경고 이벤트 action 접두사.
     */
    public static final String FAILED_EVENT_PREFIX = "Failed";

    private final String eventAction;
    private final MachineErrorReason errorReason;
    private final String progressMessage;
    private final String successFormat;

    Verb(String eventAction, MachineErrorReason errorReason, String progressMessage, String successFormat) {
        this.eventAction = eventAction;
        this.errorReason = errorReason;
        this.progressMessage = progressMessage;
        this.successFormat = successFormat;
    }

    public String eventAction() {
        return eventAction;
    }

    public MachineErrorReason errorReason() {
        return errorReason;
    }

    public String progressMessage() {
        return progressMessage;
    }

    /**
     * 성공 이벤트 메시지 형식 (%s = Machine 이름). EXISTS는 null.
     *
     * @return 형식 문자열
     */
    public String successFormat() {
        return successFormat;
    }

    /**
     * 이 동사로 분류된 Machine 오류 생성.
     *
     * @param message 상세 메시지
     * @param kind 실패 지점 분류
     * @return MachineError 인스턴스
     */
    public MachineError error(String message, FailureKind kind) {
        return new MachineError(errorReason, message, kind);
    }

    /**
     * Reconciler 실패를 Machine 오류로 변환. Reconciler가 지정한 분류가 있으면 그 분류를 사용합니다.
     *
     * @param cause Reconciler가 던진 예외
     * @return MachineError 인스턴스
     */
    public MachineError reconcileError(RuntimeException cause) {
        return new MachineError(
            FailureClassifier.reason(this, cause),
            FailureClassifier.describe(cause),
            FailureClassifier.reconcile(cause)
        );
    }
}
