package com.ryuqq.signal.core.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * 반환 Channel dispatch 결과.
 *
 * <p>핸들러마다 정확히 하나의 결과를 핸들러 실행 순서대로 담습니다.
 * 핸들러가 null을 반환할 수 있으므로 null 원소를 허용합니다.</p>
 *
 * @param values 결과 목록 (불변)
 * @param <R> 핸들러 반환 타입
 *
 * @author Signal Team
 * @since 1.0.0
 */
public record Values<R>(List<R> values) implements DispatchResult<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException values가 null인 경우
     */
    public Values {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public List<R> valuesOrEmpty() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @param position 핸들러 순위
     * @return 해당 핸들러의 결과
     */
    public R get(int position) {
        return values.get(position);
    }

    /**
     * 최댓값 조회 (null 원소 제외).
     *
     * @param comparator 비교자
     * @return 최댓값 (결과가 없으면 empty)
     */
    public Optional<R> max(Comparator<? super R> comparator) {
        return values.stream().filter(v -> v != null).max(comparator);
    }

    /**
     * 최솟값 조회 (null 원소 제외).
     *
     * @param comparator 비교자
     * @return 최솟값 (결과가 없으면 empty)
     */
    public Optional<R> min(Comparator<? super R> comparator) {
        return values.stream().filter(v -> v != null).min(comparator);
    }

    /**
     * 핸들러 순서대로 결과를 누적.
     *
     * @param identity 초기값
     * @param accumulator 누적 함수
     * @return 누적 결과
     */
    public R reduce(R identity, BinaryOperator<R> accumulator) {
        if (accumulator == null) {
            throw new IllegalArgumentException("accumulator cannot be null");
        }
        R acc = identity;
        for (R value : values) {
            acc = accumulator.apply(acc, value);
        }
        return acc;
    }
}
