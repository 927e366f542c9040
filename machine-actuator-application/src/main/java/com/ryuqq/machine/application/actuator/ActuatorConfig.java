package com.ryuqq.machine.application.actuator;

/**
 * Actuator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>skipUnmodifiedCommit: 작업 사본이 변경되지 않았을 때 close()가 저장소 기록을 생략할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p>skipUnmodifiedCommit=false여도 정확성은 버전 토큰 비교가 보장합니다.
 * 끄면 변경 없는 create/update마다 버전이 하나씩 올라갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param skipUnmodifiedCommit 변경 없는 커밋 생략 여부
 */
public record ActuatorConfig(boolean skipUnmodifiedCommit) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: skipUnmodifiedCommit=true</p>
     */
    public ActuatorConfig() {
        this(true);
    }

    /**
     * skipUnmodifiedCommit만 변경한 새 인스턴스 생성.
     *
     * @param skipUnmodifiedCommit 새 값
     * @return 새 ActuatorConfig 인스턴스
     */
    public ActuatorConfig withSkipUnmodifiedCommit(boolean skipUnmodifiedCommit) {
        return new ActuatorConfig(skipUnmodifiedCommit);
    }
}
