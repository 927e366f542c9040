package com.ryuqq.machine.core.exception;

import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.model.ResourceVersion;

/**
 * compare-and-swap 시 버전 토큰 불일치.
 *
 * <p>획득 이후 다른 작성자가 리소스를 변경했음을 의미합니다.
 * 이 계층은 재시도하지 않고 그대로 호출자에게 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class VersionConflictException extends MachineStoreException {

    private final MachineName machineName;
    private final ResourceVersion expectedVersion;
    private final ResourceVersion actualVersion;

    public VersionConflictException(MachineName machineName, ResourceVersion expectedVersion, ResourceVersion actualVersion) {
        super(String.format(
            "Operation cannot be fulfilled on machine %s: the object has been modified (expected version %s, actual version %s)",
            machineName, expectedVersion.getValue(), actualVersion.getValue()
        ));
        this.machineName = machineName;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public MachineName getMachineName() {
        return machineName;
    }

    public ResourceVersion getExpectedVersion() {
        return expectedVersion;
    }

    public ResourceVersion getActualVersion() {
        return actualVersion;
    }
}
