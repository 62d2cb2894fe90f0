package com.ryuqq.signal.testkit.contract;

import com.ryuqq.signal.core.channel.Channel2;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InvocationLog 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
class InvocationLogTest {

    @Test
    void recorder_는_호출과_인자를_순서대로_기록() {
        // given
        InvocationLog log = new InvocationLog();
        Channel2<String, Integer> channel = new Channel2<>("pair", String.class, int.class);
        channel.attach(log.recorder2("both"));
        channel.attach(log.recorder1("first"));
        channel.attach(log.recorder("none"));

        // when
        channel.trigger("a", 1);

        // then
        assertThat(log.labels()).containsExactly("both", "first", "none");
        assertThat(log.invocations().get(0).args()).containsExactly("a", 1);
        assertThat(log.invocations().get(1).args()).containsExactly("a");
        assertThat(log.firstArguments()).containsExactly("a", "a", null);
    }

    @Test
    void count_와_clear() {
        InvocationLog log = new InvocationLog();
        log.record("x");
        log.record("x", 1);
        log.record("y");

        assertThat(log.count("x")).isEqualTo(2);
        assertThat(log.size()).isEqualTo(3);

        log.clear();
        assertThat(log.size()).isZero();
    }

    @Test
    void null_인자도_기록() {
        InvocationLog log = new InvocationLog();

        log.record("nullable", (Object) null);

        List<Object> args = log.invocations().get(0).args();
        assertThat(args).isEqualTo(Arrays.asList((Object) null));
    }

    @Test
    void null_라벨은_거부() {
        assertThatThrownBy(() -> new InvocationLog().record(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
