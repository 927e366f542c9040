package com.ryuqq.machine.core.model;

import java.util.Objects;

/**
 * Machine 리소스 (클러스터의 컴퓨트 단위).
 *
 * <p>저장소가 소유하는 리소스의 불변 스냅샷입니다. 변경은 새 인스턴스를 만들어 표현하며,
 * {@code withSpec}/{@code withStatus}는 버전 토큰을 그대로 유지합니다.
 * 새 버전은 저장소만 부여합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Machine {

    private final MachineName name;
    private final MachineSpec spec;
    private final MachineStatus status;
    private final ResourceVersion version;

    private Machine(MachineName name, MachineSpec spec, MachineStatus status, ResourceVersion version) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        this.name = name;
        this.spec = spec;
        this.status = status;
        this.version = version;
    }

    /**
     * Machine 생성.
     *
     * @param name 이름
     * @param spec 원하는 상태
     * @param status 관측된 상태
     * @param version 버전 토큰
     * @return Machine 인스턴스
     * @throws IllegalArgumentException 인자 중 하나라도 null인 경우
     */
    public static Machine of(MachineName name, MachineSpec spec, MachineStatus status, ResourceVersion version) {
        return new Machine(name, spec, status, version);
    }

    public MachineName getName() {
        return name;
    }

    public MachineSpec getSpec() {
        return spec;
    }

    public MachineStatus getStatus() {
        return status;
    }

    public ResourceVersion getVersion() {
        return version;
    }

    public Machine withSpec(MachineSpec spec) {
        return new Machine(this.name, spec, this.status, this.version);
    }

    public Machine withStatus(MachineStatus status) {
        return new Machine(this.name, this.spec, status, this.version);
    }

    public Machine withVersion(ResourceVersion version) {
        return new Machine(this.name, this.spec, this.status, version);
    }

    /**
     * 버전 토큰을 제외한 내용(spec, status)이 같은지 비교.
     *
     * @param other 비교 대상
     * @return 이름, spec, status가 모두 같으면 true
     */
    public boolean sameContentAs(Machine other) {
        return other != null
            && name.equals(other.name)
            && spec.equals(other.spec)
            && status.equals(other.status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Machine machine = (Machine) o;
        return sameContentAs(machine) && version.equals(machine.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, spec, status, version);
    }

    @Override
    public String toString() {
        return "Machine{name=" + name + ", version=" + version.getValue() + '}';
    }
}
