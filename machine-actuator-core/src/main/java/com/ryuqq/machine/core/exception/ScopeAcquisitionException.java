package com.ryuqq.machine.core.exception;

import com.ryuqq.machine.core.model.MachineName;

/**
 * Machine Scope를 만들 수 없음.
 *
 * <p>원인(cause)은 항상 채워져 있습니다: 저장소에 없음, 전송 오류, 잘못된 리소스, 컨텍스트 취소.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScopeAcquisitionException extends RuntimeException {

    private final MachineName machineName;

    public ScopeAcquisitionException(MachineName machineName, Throwable cause) {
        super(cause.getMessage(), cause);
        this.machineName = machineName;
    }

    public MachineName getMachineName() {
        return machineName;
    }
}
