package com.ryuqq.signal.core.handler;

/**
 * 타입 소거된 핸들러 호출 형태.
 *
 * <p>Channel 내부 저장 형태이며, 인자 배열은 항상 Channel 선언 개수만큼 전달됩니다.
 * 타입이 있는 핸들러는 {@link Handlers}가 이 형태로 변환합니다.</p>
 *
 * @param <R> 반환 타입 (void Channel은 {@link Void})
 * @author Signal Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Handler<R> {

    /**
     * @param args Channel 선언 순서의 인자
     * @return 핸들러 결과 (void Channel은 null)
     */
    R invoke(Object[] args);
}
