package com.ryuqq.signal.core.handler;

import com.ryuqq.signal.core.config.FailurePolicy;
import com.ryuqq.signal.core.exception.HandlerFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HandlerSet 유닛 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
class HandlerSetTest {

    private static final Object[] NO_ARGS = new Object[0];

    private HandlerSet<String> handlers;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        handlers = new HandlerSet<>("test-set");
        calls = new ArrayList<>();
    }

    @Test
    void add_핸들러는_추가_순서대로_위치를_받는다() {
        assertThat(handlers.add(args -> "a")).isEqualTo(0);
        assertThat(handlers.add(args -> "b")).isEqualTo(1);
        assertThat(handlers.size()).isEqualTo(2);
        assertThat(handlers.isEmpty()).isFalse();
    }

    @Test
    void add_null_핸들러는_거부() {
        assertThatThrownBy(() -> handlers.add(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void collect_핸들러마다_하나의_결과를_순서대로_반환() {
        // given
        handlers.add(args -> "first:" + args[0]);
        handlers.add(args -> "second:" + args[0]);

        // when
        List<String> results = handlers.collect(new Object[] {7}, FailurePolicy.FAIL_FAST);

        // then
        assertThat(results).containsExactly("first:7", "second:7");
    }

    @Test
    void collect_null_결과도_자리를_차지한다() {
        handlers.add(args -> null);
        handlers.add(args -> "x");

        assertThat(handlers.collect(NO_ARGS, FailurePolicy.FAIL_FAST)).containsExactly(null, "x");
    }

    @Test
    void remove_중간_항목_제거시_뒤쪽이_당겨진다() {
        // given
        handlers.add(args -> "a");
        handlers.add(args -> "b");
        handlers.add(args -> "c");

        // when
        handlers.remove(1);

        // then
        assertThat(handlers.collect(NO_ARGS, FailurePolicy.FAIL_FAST)).containsExactly("a", "c");
    }

    @Test
    void remove_범위_밖_위치는_거부() {
        handlers.add(args -> "a");

        assertThatThrownBy(() -> handlers.remove(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handlers.remove(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void run_실행_중_추가된_핸들러는_다음_실행부터_호출된다() {
        // given
        handlers.add(args -> {
            calls.add("outer");
            handlers.add(inner -> {
                calls.add("late");
                return null;
            });
            return null;
        });

        // when
        handlers.run(NO_ARGS, FailurePolicy.FAIL_FAST);

        // then
        assertThat(calls).containsExactly("outer");
        assertThat(handlers.size()).isEqualTo(2);
    }

    @Test
    void run_FAIL_FAST_첫_실패에서_중단하고_원래_예외를_전파() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");
        handlers.add(args -> { calls.add("a"); return null; });
        handlers.add(args -> { throw boom; });
        handlers.add(args -> { calls.add("c"); return null; });

        // when & then
        assertThatThrownBy(() -> handlers.run(NO_ARGS, FailurePolicy.FAIL_FAST)).isSameAs(boom);
        assertThat(calls).containsExactly("a");
    }

    @Test
    void run_CONTINUE_모든_핸들러_실행_후_실패를_모아서_전파() {
        // given
        handlers.add(args -> { throw new IllegalStateException("first"); });
        handlers.add(args -> { calls.add("b"); return null; });
        handlers.add(args -> { throw new IllegalArgumentException("third"); });

        // when & then
        assertThatThrownBy(() -> handlers.run(NO_ARGS, FailurePolicy.CONTINUE))
            .isInstanceOfSatisfying(HandlerFailureException.class, e -> {
                assertThat(e.getChannelName()).isEqualTo("test-set");
                assertThat(e.getFailures()).extracting(HandlerFailureException.Failure::position)
                    .containsExactly(0, 2);
                assertThat(e.getCause()).hasMessage("first");
                assertThat(e.getSuppressed()).hasSize(1);
            });
        assertThat(calls).containsExactly("b");
    }

    @Test
    void snapshot_은_불변_복사본() {
        handlers.add(args -> "a");

        List<Handler<String>> snapshot = handlers.snapshot();
        handlers.add(args -> "b");

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(args -> "c")).isInstanceOf(UnsupportedOperationException.class);
    }
}
