package com.ryuqq.machine.core.model;

/**
 * Machine 리소스의 안정적인 식별자.
 *
 * <p>MachineName은 백업 저장소, 이벤트, 로그에서 Machine을 가리키는 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~253자</li>
 *   <li>패턴: 소문자 영숫자, 하이픈(-), 점(.)만 허용, 영숫자로 시작/종료</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MachineName {

    private static final int MAX_LENGTH = 253;

    private final String value;

    private MachineName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MachineName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("MachineName length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-z0-9]([-a-z0-9.]*[a-z0-9])?$")) {
            throw new IllegalArgumentException(
                "MachineName contains invalid characters. Only lowercase alphanumeric, hyphen, and dot are allowed: " + value);
        }
        this.value = value;
    }

    /**
     * MachineName 생성.
     *
     * @param value 이름 값
     * @return MachineName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MachineName of(String value) {
        return new MachineName(value);
    }

    /**
     * 이름 값 조회.
     *
     * @return 이름 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MachineName that = (MachineName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
