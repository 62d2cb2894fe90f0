package com.ryuqq.signal.core.result;

import java.util.List;

/**
 * void Channel dispatch 결과.
 *
 * @param <R> 핸들러 반환 타입
 * @author Signal Team
 * @since 1.0.0
 */
public record Unit<R>() implements DispatchResult<R> {

    @Override
    public List<R> valuesOrEmpty() {
        return List.of();
    }
}
