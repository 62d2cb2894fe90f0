package com.ryuqq.signal.core.exception;

/**
 * 타입 소거 경로 호출의 인자 개수, 인자 타입 또는 반환 타입이
 * Channel 선언과 일치하지 않을 때 발생합니다.
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class TypeMismatchException extends SignalException {

    private final int position;

    public TypeMismatchException(String message) {
        this(message, -1);
    }

    public TypeMismatchException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return 불일치한 인자 위치 (인자 개수 또는 반환 타입 불일치면 -1)
     */
    public int getPosition() {
        return position;
    }
}
