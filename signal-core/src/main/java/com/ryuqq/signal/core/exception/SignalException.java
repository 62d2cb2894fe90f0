package com.ryuqq.signal.core.exception;

/**
 * Signal SDK 예외의 공통 상위 타입.
 *
 * <p>하위 예외는 모두 호출 측의 잘못된 사용(프로그래밍 오류)을 나타내며,
 * 재시도로 해결되지 않습니다. 단, {@link HandlerFailureException}은
 * 핸들러 내부 실패를 모아 전달합니다.</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class SignalException extends RuntimeException {

    public SignalException(String message) {
        super(message);
    }

    public SignalException(String message, Throwable cause) {
        super(message, cause);
    }
}
