package com.ryuqq.machine.core.outcome;

import com.ryuqq.machine.core.model.MachineName;

/**
 * 성공 결과.
 *
 * @param machine 대상 Machine 이름
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    MachineName machine,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException machine이 null인 경우
     */
    public Ok {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        // message는 null 허용
    }

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param machine 대상 Machine 이름
     * @return Ok 인스턴스
     */
    public static Ok of(MachineName machine) {
        return new Ok(machine, null);
    }
}
