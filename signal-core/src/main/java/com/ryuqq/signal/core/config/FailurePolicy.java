package com.ryuqq.signal.core.config;

/**
 * 핸들러가 예외를 던졌을 때 trigger 진행 방식.
 *
 * @author Signal Team
 * @since 1.0.0
 */
public enum FailurePolicy {

    /**
     * 첫 번째 실패에서 중단하고 예외를 그대로 전파 (기본값).
     *
     * <p>이후 핸들러는 실행되지 않으며, 예외는 감싸지 않습니다.</p>
     */
    FAIL_FAST,

    /**
     * 모든 핸들러를 실행한 뒤 실패를 모아 {@code HandlerFailureException}으로 전파.
     */
    CONTINUE
}
