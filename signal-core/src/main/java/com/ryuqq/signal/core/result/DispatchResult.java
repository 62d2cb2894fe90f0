package com.ryuqq.signal.core.result;

import java.util.List;

/**
 * 타입 소거 경로 dispatch 결과.
 *
 * <p>DispatchResult는 두 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Unit}: void Channel 실행 완료 (결과 없음)</li>
 *   <li>{@link Values}: 반환 Channel 실행 결과, 핸들러마다 하나씩 핸들러 순서대로</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DispatchResult&lt;?&gt; result = channel.dispatch(5);
 * if (result instanceof Values&lt;?&gt; values) {
 *     values.values().forEach(System.out::println);
 * }
 * </pre>
 *
 * @param <R> 핸들러 반환 타입
 * @author Signal Team
 * @since 1.0.0
 */
public sealed interface DispatchResult<R> permits Unit, Values {

    /**
     * @return void 결과 여부
     */
    default boolean isUnit() {
        return this instanceof Unit;
    }

    /**
     * @return 값 목록 결과 여부
     */
    default boolean isValues() {
        return this instanceof Values;
    }

    /**
     * @return 결과 값 목록 ({@link Unit}이면 빈 목록)
     */
    List<R> valuesOrEmpty();

    /**
     * void 결과.
     *
     * @param <R> 핸들러 반환 타입
     * @return Unit 인스턴스
     */
    static <R> DispatchResult<R> unit() {
        return new Unit<>();
    }

    /**
     * 값 목록 결과.
     *
     * @param values 핸들러 순서의 결과
     * @param <R> 핸들러 반환 타입
     * @return Values 인스턴스
     */
    static <R> DispatchResult<R> values(List<R> values) {
        return new Values<>(values);
    }
}
