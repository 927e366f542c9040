package com.ryuqq.machine.core.model;

/**
 * 낙관적 동시성 제어용 버전 토큰.
 *
 * <p>값의 의미는 저장소 구현에 달려 있으며, 이 계층에서는 동등성 비교에만 사용합니다.
 * compare-and-swap 시 획득 시점의 토큰과 저장소의 현재 토큰이 다르면 충돌입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceVersion {

    private final String value;

    private ResourceVersion(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceVersion cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * ResourceVersion 생성.
     *
     * @param value 토큰 값
     * @return ResourceVersion 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceVersion of(String value) {
        return new ResourceVersion(value);
    }

    /**
     * 토큰 값 조회.
     *
     * @return 토큰 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceVersion that = (ResourceVersion) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceVersion{" + value + '}';
    }
}
