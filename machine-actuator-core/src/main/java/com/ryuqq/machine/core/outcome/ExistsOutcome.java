package com.ryuqq.machine.core.outcome;

/**
 * Exists 동사 실행 결과.
 *
 * <ul>
 *   <li>{@link Existence}: Reconciler의 판단 (존재/부재)</li>
 *   <li>{@link Fail}: 판단 불가, {@link MachineError} 포함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ExistsOutcome permits Existence, Fail {

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
