package com.ryuqq.machine.core.outcome;

import com.ryuqq.machine.core.model.MachineName;

/**
 * Exists 동사의 정상 결과.
 *
 * @param machine 대상 Machine 이름
 * @param exists 프로바이더 측에 Machine이 존재하는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Existence(
    MachineName machine,
    boolean exists
) implements ExistsOutcome {

    public Existence {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
    }
}
