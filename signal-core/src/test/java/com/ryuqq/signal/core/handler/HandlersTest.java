package com.ryuqq.signal.core.handler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Handlers 어댑터 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
class HandlersTest {

    @Test
    void of_Consumer_첫_인자만_전달하고_나머지는_버린다() {
        // given
        List<Object> seen = new ArrayList<>();
        Consumer<String> consumer = seen::add;

        // when
        Handlers.of(consumer).invoke(new Object[] {"a", 1, 2.0});

        // then
        assertThat(seen).containsExactly("a");
    }

    @Test
    void of_BiConsumer_앞의_두_인자만_전달() {
        List<Object> seen = new ArrayList<>();
        BiConsumer<String, Integer> consumer = (s, i) -> seen.add(s + i);

        Handlers.of(consumer).invoke(new Object[] {"a", 1, "ignored"});

        assertThat(seen).containsExactly("a1");
    }

    @Test
    void of_TriConsumer_세_인자_전달() {
        List<Object> seen = new ArrayList<>();
        TriConsumer<Integer, Integer, Integer> consumer = (a, b, c) -> seen.add(a + b + c);

        Object result = Handlers.of(consumer).invoke(new Object[] {1, 2, 3});

        assertThat(seen).containsExactly(6);
        assertThat(result).isNull();
    }

    @Test
    void of_Runnable_모든_인자를_버린다() {
        List<Object> seen = new ArrayList<>();
        Runnable runnable = () -> seen.add("ran");

        Handlers.of(runnable).invoke(new Object[] {1, 2});

        assertThat(seen).containsExactly("ran");
    }

    @Test
    void returning_Function_결과를_반환() {
        Function<Integer, Integer> doubler = x -> x * 2;

        assertThat(Handlers.returning(doubler).invoke(new Object[] {5, "extra"})).isEqualTo(10);
    }

    @Test
    void returning_TriFunction_결과를_반환() {
        TriFunction<Integer, Integer, Integer, Integer> sum = (a, b, c) -> a + b + c;

        assertThat(Handlers.returning(sum).invoke(new Object[] {1, 2, 3})).isEqualTo(6);
    }

    @Test
    void cast_는_같은_값을_정적_타입으로_돌려준다() {
        Object erased = "text";

        String value = Handlers.cast(erased);

        assertThat(value).isSameAs(erased);
        assertThat(Handlers.<String>cast(null)).isNull();
    }

    @Test
    void null_핸들러는_거부() {
        assertThatThrownBy(() -> Handlers.of((Runnable) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handler cannot be null");
    }
}
