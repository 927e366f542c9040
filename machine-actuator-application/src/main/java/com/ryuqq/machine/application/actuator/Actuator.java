package com.ryuqq.machine.application.actuator;

import com.ryuqq.machine.core.context.CallContext;
import com.ryuqq.machine.core.model.MachineName;
import com.ryuqq.machine.core.outcome.ExistsOutcome;
import com.ryuqq.machine.core.outcome.Outcome;

/**
 * Machine 라이프사이클 Actuator.
 *
 * <p>호스트 리컨실리에이션 컨트롤러가 호출하는 네 가지 동사를 제공합니다.
 * 언제, 얼마나 자주 호출할지와 재시도/백오프 정책은 호출자가 결정합니다.</p>
 *
 * <p><strong>사용 예시 (한 번의 리컨실리에이션 패스):</strong></p>
 * <pre>
 * ExistsOutcome existence = actuator.exists(context, name);
 * if (existence instanceof Fail fail) {
 *     return requeue(fail.error());
 * }
 * Outcome outcome = ((Existence) existence).exists()
 *     ? actuator.update(context, name)
 *     : actuator.create(context, name);
 * </pre>
 *
 * <p><strong>커밋 규칙:</strong> 한 패스의 모든 저장은 create 또는 update 안에서 정확히 한 번 일어납니다.
 * exists는 저장하지 않으므로 이어지는 create/update가 오래된 버전 토큰으로 충돌하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Actuator {

    /**
     * Machine 생성.
     *
     * @param context 호출 컨텍스트
     * @param name 대상 Machine 이름
     * @return Ok 또는 Fail(CreateError)
     * @throws IllegalArgumentException context 또는 name이 null인 경우
     */
    Outcome create(CallContext context, MachineName name);

    /**
     * Machine 존재 여부 확인. 저장소에 기록하지 않습니다.
     *
     * @param context 호출 컨텍스트
     * @param name 대상 Machine 이름
     * @return Existence 또는 Fail(ExistsError)
     * @throws IllegalArgumentException context 또는 name이 null인 경우
     */
    ExistsOutcome exists(CallContext context, MachineName name);

    /**
     * Machine 갱신.
     *
     * @param context 호출 컨텍스트
     * @param name 대상 Machine 이름
     * @return Ok 또는 Fail(UpdateError)
     * @throws IllegalArgumentException context 또는 name이 null인 경우
     */
    Outcome update(CallContext context, MachineName name);

    /**
     * Machine 삭제. Scope를 close하지 않습니다.
     *
     * @param context 호출 컨텍스트
     * @param name 대상 Machine 이름
     * @return Ok 또는 Fail(DeleteError)
     * @throws IllegalArgumentException context 또는 name이 null인 경우
     */
    Outcome delete(CallContext context, MachineName name);
}
