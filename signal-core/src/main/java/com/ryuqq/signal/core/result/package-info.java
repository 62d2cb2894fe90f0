/**
 * Dispatch 결과 타입.
 *
 * <p>{@link com.ryuqq.signal.core.result.DispatchResult}는 sealed interface로,
 * void Channel은 {@link com.ryuqq.signal.core.result.Unit},
 * 반환 Channel은 {@link com.ryuqq.signal.core.result.Values}를 반환합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.signal.core.result;
