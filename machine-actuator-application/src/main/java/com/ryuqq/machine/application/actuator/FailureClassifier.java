package com.ryuqq.machine.application.actuator;

import com.ryuqq.machine.core.exception.ContextCancelledException;
import com.ryuqq.machine.core.exception.MachineNotFoundException;
import com.ryuqq.machine.core.exception.MachineStoreException;
import com.ryuqq.machine.core.exception.ReconcileException;
import com.ryuqq.machine.core.exception.VersionConflictException;
import com.ryuqq.machine.core.outcome.FailureKind;
import com.ryuqq.machine.core.outcome.MachineErrorReason;

/**
 * 예외를 {@link FailureKind}로 분류.
 *
 * <p>저장소 전송 오류와 컨텍스트 취소는 어느 단계에서 발생하든 TRANSPORT입니다.
 * close 시점의 not-found는 획득 이후 리소스가 사라진 것이므로 버전 충돌과 같이 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class FailureClassifier {

    private FailureClassifier() {
    }

    static FailureKind acquisition(Throwable cause) {
        if (cause instanceof MachineNotFoundException) {
            return FailureKind.SCOPE_ACQUISITION;
        }
        return isTransport(cause) ? FailureKind.TRANSPORT : FailureKind.SCOPE_ACQUISITION;
    }

    static FailureKind reconcile(Throwable cause) {
        return isTransport(cause) ? FailureKind.TRANSPORT : FailureKind.RECONCILE;
    }

    static FailureKind commit(Throwable cause) {
        if (cause instanceof VersionConflictException || cause instanceof MachineNotFoundException) {
            return FailureKind.COMMIT_CONFLICT;
        }
        return FailureKind.TRANSPORT;
    }

    /**
     * Reconciler 실패의 분류. Reconciler가 지정한 분류가 없으면 동사의 분류를 사용합니다.
     *
     * @param verb 동사
     * @param cause Reconciler가 던진 예외
     * @return Machine 오류 분류
     */
    static MachineErrorReason reason(Verb verb, Throwable cause) {
        if (cause instanceof ReconcileException) {
            return ((ReconcileException) cause).getReason().orElse(verb.errorReason());
        }
        return verb.errorReason();
    }

    /**
     * 예외를 사람이 읽을 수 있는 문구로 변환. 메시지가 없으면 클래스 이름을 사용합니다.
     *
     * @param cause 예외
     * @return 빈 문자열이 아닌 설명
     */
    static String describe(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }

    private static boolean isTransport(Throwable cause) {
        return cause instanceof ContextCancelledException
            || (cause instanceof MachineStoreException && !(cause instanceof MachineNotFoundException));
    }
}
