package com.ryuqq.machine.core.outcome;

/**
 * 실패 결과.
 *
 * <p>모든 동사의 실패 경로가 공유합니다. 담고 있는 {@link MachineError}는
 * 오류 핸들러가 만든 그대로이며 수정되지 않습니다.</p>
 *
 * @param error 타입이 있는 Machine 오류
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(MachineError error) implements Outcome, ExistsOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Fail {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    /**
     * Fail 생성.
     *
     * @param error Machine 오류
     * @return Fail 인스턴스
     */
    public static Fail of(MachineError error) {
        return new Fail(error);
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public MachineErrorReason reason() {
        return error.reason();
    }

    /**
     * 오류 메시지 조회.
     *
     * @return 상세 메시지
     */
    public String message() {
        return error.message();
    }

    @Override
    public boolean isFail() {
        return true;
    }
}
