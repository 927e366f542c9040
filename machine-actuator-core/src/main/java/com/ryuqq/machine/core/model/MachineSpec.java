package com.ryuqq.machine.core.model;

import java.util.Map;

/**
 * Machine의 원하는 상태 (소유자가 작성).
 *
 * <p>providerSpec은 클라우드 프로바이더별 설정으로, 이 계층에서는 해석하지 않습니다.</p>
 *
 * @param providerId 프로바이더가 부여한 인스턴스 ID (선택, null 가능)
 * @param providerSpec 프로바이더별 설정 (불변 복사본)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MachineSpec(
    String providerId,
    Map<String, String> providerSpec
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException providerSpec이 null인 경우
     */
    public MachineSpec {
        if (providerSpec == null) {
            throw new IllegalArgumentException("providerSpec cannot be null");
        }
        providerSpec = Map.copyOf(providerSpec);
        // providerId는 null 허용 (아직 프로비저닝 전)
    }

    /**
     * providerId 없이 MachineSpec 생성.
     *
     * @param providerSpec 프로바이더별 설정
     * @return MachineSpec 인스턴스
     */
    public static MachineSpec of(Map<String, String> providerSpec) {
        return new MachineSpec(null, providerSpec);
    }

    /**
     * providerId만 변경한 새 인스턴스 생성.
     *
     * @param providerId 새 providerId
     * @return 새 MachineSpec 인스턴스
     */
    public MachineSpec withProviderId(String providerId) {
        return new MachineSpec(providerId, this.providerSpec);
    }
}
