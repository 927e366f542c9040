package com.ryuqq.machine.core.spi;

import com.ryuqq.machine.core.model.Machine;

/**
 * Scope 획득 시점의 리소스 검증.
 *
 * <p>프로바이더별 설정을 해석할 수 없는 리소스(잘못된 providerSpec 등)는
 * 여기서 거부되어 Scope 획득 실패로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MachineValidator {

    /**
     * 리소스 검증.
     *
     * @param machine 방금 읽은 Machine
     * @throws IllegalArgumentException 리소스가 유효하지 않은 경우 (메시지에 사유 포함)
     */
    void validate(Machine machine);

    /**
     * 모든 리소스를 허용하는 검증기.
     *
     * @return 아무것도 거부하지 않는 MachineValidator
     */
    static MachineValidator acceptAll() {
        return machine -> { };
    }

    /**
     * providerSpec에 지정한 키가 모두 있는지 검사하는 검증기.
     *
     * @param keys 필수 키
     * @return MachineValidator 인스턴스
     */
    static MachineValidator requireProviderSpecKeys(String... keys) {
        return machine -> {
            for (String key : keys) {
                String value = machine.getSpec().providerSpec().get(key);
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("providerSpec is missing required key '" + key + "'");
                }
            }
        };
    }
}
