package com.ryuqq.signal.core.config;

/**
 * Channel dispatch 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failurePolicy: 핸들러 실패 시 처리 방식 (기본 FAIL_FAST)</li>
 * </ul>
 *
 * @author Signal Team
 * @since 1.0.0
 * @param failurePolicy 핸들러 실패 정책 (null 불가)
 */
public record DispatchConfig(FailurePolicy failurePolicy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failurePolicy=FAIL_FAST</p>
     */
    public DispatchConfig() {
        this(FailurePolicy.FAIL_FAST);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException failurePolicy가 null인 경우
     */
    public DispatchConfig {
        if (failurePolicy == null) {
            throw new IllegalArgumentException("failurePolicy cannot be null");
        }
    }

    /**
     * failurePolicy만 변경한 새 인스턴스 생성.
     *
     * @param failurePolicy 새로운 실패 정책
     * @return 새 DispatchConfig 인스턴스
     */
    public DispatchConfig withFailurePolicy(FailurePolicy failurePolicy) {
        return new DispatchConfig(failurePolicy);
    }
}
