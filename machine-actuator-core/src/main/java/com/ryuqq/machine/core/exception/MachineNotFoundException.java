package com.ryuqq.machine.core.exception;

import com.ryuqq.machine.core.model.MachineName;

/**
 * 저장소에 해당 Machine이 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MachineNotFoundException extends MachineStoreException {

    private final MachineName machineName;

    public MachineNotFoundException(MachineName machineName) {
        super("machine " + machineName + " not found");
        this.machineName = machineName;
    }

    public MachineName getMachineName() {
        return machineName;
    }
}
