package com.ryuqq.machine.core.outcome;

/**
 * Create/Update/Delete 동사 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨 (커밋 포함)</li>
 *   <li>{@link Fail}: 실패, {@link MachineError} 포함</li>
 * </ul>
 *
 * <p>오류는 예외로 던지지 않고 반환 값으로 전달됩니다. 재시도 여부는 호출자(호스트 컨트롤러)가 결정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = actuator.create(context, name);
 * if (outcome instanceof Fail fail) {
 *     requeue(name, fail.error());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
