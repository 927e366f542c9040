package com.ryuqq.machine.core.model;

/**
 * Machine이 속한 클러스터 참조.
 *
 * @param name 클러스터 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ClusterRef(String name) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public ClusterRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("cluster name cannot be null or blank");
        }
    }

    /**
     * ClusterRef 생성.
     *
     * @param name 클러스터 이름
     * @return ClusterRef 인스턴스
     */
    public static ClusterRef of(String name) {
        return new ClusterRef(name);
    }
}
