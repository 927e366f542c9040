package com.ryuqq.machine.core.model;

import java.util.List;
import java.util.Map;

/**
 * Machine의 관측된 상태 (Reconciler가 작성).
 *
 * @param providerStatus 프로바이더별 상태 (불변 복사본)
 * @param addresses 인스턴스 주소 목록 (불변 복사본)
 * @param instanceState 인스턴스 상태 (선택, null 가능. 예: RUNNING)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MachineStatus(
    Map<String, String> providerStatus,
    List<String> addresses,
    String instanceState
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException providerStatus 또는 addresses가 null인 경우
     */
    public MachineStatus {
        if (providerStatus == null) {
            throw new IllegalArgumentException("providerStatus cannot be null");
        }
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        providerStatus = Map.copyOf(providerStatus);
        addresses = List.copyOf(addresses);
    }

    /**
     * 빈 상태 생성 (아직 관측된 것이 없음).
     *
     * @return 빈 MachineStatus
     */
    public static MachineStatus empty() {
        return new MachineStatus(Map.of(), List.of(), null);
    }

    /**
     * instanceState만 변경한 새 인스턴스 생성.
     *
     * @param instanceState 새 인스턴스 상태
     * @return 새 MachineStatus 인스턴스
     */
    public MachineStatus withInstanceState(String instanceState) {
        return new MachineStatus(this.providerStatus, this.addresses, instanceState);
    }

    /**
     * addresses만 변경한 새 인스턴스 생성.
     *
     * @param addresses 새 주소 목록
     * @return 새 MachineStatus 인스턴스
     */
    public MachineStatus withAddresses(List<String> addresses) {
        return new MachineStatus(this.providerStatus, addresses, this.instanceState);
    }
}
