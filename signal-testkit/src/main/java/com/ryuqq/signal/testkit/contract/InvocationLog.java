package com.ryuqq.signal.testkit.contract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Handler 호출 기록기.
 *
 * <p>테스트에서 핸들러가 어떤 순서로, 어떤 인자로 호출되었는지 기록합니다.
 * {@code recorder(...)} 메서드가 돌려주는 함수를 Channel에 등록하면 호출마다
 * 하나의 {@link Invocation}이 추가됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * InvocationLog log = new InvocationLog();
 * channel.attach(log.recorder("h1"));
 * channel.trigger(42);
 * assertThat(log.labels()).containsExactly("h1");
 * </pre>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class InvocationLog {

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();

    /**
     * 호출 1건 기록.
     *
     * @param label 핸들러 라벨
     * @param args 호출 인자
     */
    public void record(String label, Object... args) {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        invocations.add(new Invocation(label, args == null ? List.of() : Arrays.asList(args.clone())));
    }

    /**
     * 인자 없는 기록 함수.
     */
    public Runnable recorder(String label) {
        return () -> record(label);
    }

    /**
     * 인자 1개 기록 함수.
     */
    public <A> Consumer<A> recorder1(String label) {
        return a -> record(label, a);
    }

    /**
     * 인자 2개 기록 함수.
     */
    public <A, B> BiConsumer<A, B> recorder2(String label) {
        return (a, b) -> record(label, a, b);
    }

    /**
     * @return 기록된 호출 목록 (기록 순서)
     */
    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * @return 호출 순서대로의 라벨 목록
     */
    public List<String> labels() {
        List<String> labels = new ArrayList<>(invocations.size());
        for (Invocation invocation : invocations) {
            labels.add(invocation.label());
        }
        return labels;
    }

    /**
     * 호출마다 첫 번째 인자를 모은 목록.
     *
     * @return 첫 번째 인자 목록 (인자가 없는 호출은 null)
     */
    public List<Object> firstArguments() {
        List<Object> firsts = new ArrayList<>(invocations.size());
        for (Invocation invocation : invocations) {
            firsts.add(invocation.args().isEmpty() ? null : invocation.args().get(0));
        }
        return firsts;
    }

    public int count(String label) {
        int count = 0;
        for (Invocation invocation : invocations) {
            if (invocation.label().equals(label)) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return invocations.size();
    }

    public void clear() {
        invocations.clear();
    }

    /**
     * 기록된 호출 1건.
     *
     * @param label 핸들러 라벨
     * @param args 호출 인자 (null 원소 허용)
     */
    public record Invocation(String label, List<Object> args) {
    }
}
