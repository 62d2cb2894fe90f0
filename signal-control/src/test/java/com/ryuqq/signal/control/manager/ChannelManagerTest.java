package com.ryuqq.signal.control.manager;

import com.ryuqq.signal.core.channel.Channel;
import com.ryuqq.signal.core.channel.Channel0;
import com.ryuqq.signal.core.channel.Channel1;
import com.ryuqq.signal.core.channel.QueryChannel1;
import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.config.FailurePolicy;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

/**
 * ChannelManager 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ChannelManagerTest {

    @Mock
    private ChannelRegistry observer;

    private ChannelManager manager;

    @BeforeEach
    void setUp() {
        manager = new ChannelManager();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void 팩토리로_만든_Channel은_이름으로_조회되고_Manager가_primary() {
        // when
        Channel1<Integer> hits = manager.channel1("hits", int.class);
        QueryChannel1<Integer, Integer> calc = manager.query1("calc", int.class, int.class);

        // then
        assertThat(manager.names()).containsExactly("hits", "calc");
        assertThat(manager.get("hits")).isSameAs(hits);
        assertThat(manager.contains("calc")).isTrue();
        assertThat(hits.getPrimaryRegistry()).contains(manager);
        assertThat(calc.getConfig()).isEqualTo(manager.getConfig().defaultDispatch());
    }

    @Test
    void 이름_없는_Channel은_접두사와_id로_이름을_받는다() {
        // given
        ChannelManager custom = new ChannelManager(new ManagerConfig().withGeneratedNamePrefix("evt-"));

        // when
        Channel0 channel = custom.channel0(null);

        // then
        assertThat(custom.names()).containsExactly("evt-" + channel.getChannelId());
        assertThat(custom.nameOf(channel)).isEqualTo("evt-" + channel.getChannelId());
        custom.close();
    }

    @Test
    void 중복_이름은_거부() {
        manager.channel0("dup");

        assertThatThrownBy(() -> manager.channel1("dup", String.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered: dup");
        assertThatThrownBy(() -> manager.adopt(new Channel0("dup")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    void get_타입_지정_조회() {
        manager.channel1("hits", int.class);

        Channel1<?> hits = manager.get("hits", Channel1.class);

        assertThat(hits.getName()).isEqualTo("hits");
        assertThatThrownBy(() -> manager.get("hits", QueryChannel1.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("is a Channel1, not a QueryChannel1");
    }

    @Test
    void 알_수_없는_이름은_예외() {
        assertThatThrownBy(() -> manager.get("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown channel: missing");
        assertThat(manager.find("missing")).isEmpty();
    }

    @Test
    void 생성자에_registry로_전달된_Channel은_파괴_시_목록에서_빠진다() {
        // given
        Channel0 channel = new Channel0("borrowed", manager, new DispatchConfig());
        assertThat(manager.contains("borrowed")).isTrue();

        // when
        channel.destroy();

        // then
        assertThat(manager.contains("borrowed")).isFalse();
    }

    @Test
    void adopt_후에는_Manager가_primary이며_다른_registry는_알림을_받는다() {
        // given
        Channel1<String> channel = new Channel1<>("adopted", observer, new DispatchConfig(), String.class);

        // when
        manager.adopt(channel);
        manager.close();

        // then
        assertThat(channel.isDestroyed()).isTrue();
        verify(observer).notifyDestruct(channel);
        assertThat(manager.size()).isZero();
    }

    @Test
    void close_는_소유한_Channel을_파괴하고_나머지는_추적만_해제() {
        // given
        Channel0 owned = manager.channel0("owned");
        Channel0 borrowed = new Channel0("borrowed", manager, new DispatchConfig());
        List<String> log = new ArrayList<>();
        borrowed.attach(() -> log.add("still alive"));

        // when
        manager.close();

        // then
        assertThat(owned.isDestroyed()).isTrue();
        assertThat(borrowed.isDestroyed()).isFalse();
        assertThat(borrowed.getRegistries()).isEmpty();
        borrowed.trigger();
        assertThat(log).containsExactly("still alive");
        assertThat(manager.isClosed()).isTrue();
    }

    @Test
    void 소유한_Channel을_직접_닫으면_목록에서_빠지고_이름을_재사용할_수_있다() {
        // given
        try (Channel1<Integer> hits = manager.channel1("hits", int.class)) {
            hits.attach(x -> { });
        }

        // when & then
        assertThat(manager.contains("hits")).isFalse();
        assertThat(manager.names()).doesNotContain("hits");
        assertThat(manager.channels()).isEmpty();
        assertThat(manager.size()).isZero();

        Channel1<Integer> again = manager.channel1("hits", int.class);
        assertThat(manager.get("hits")).isSameAs(again);
    }

    @Test
    void 소유한_Channel을_직접_파괴하면_조회는_Unknown_channel() {
        // given
        Channel0 owned = manager.channel0("owned");

        // when
        owned.destroy();

        // then
        assertThatThrownBy(() -> manager.get("owned"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown channel: owned");
        assertThat(manager.find("owned")).isEmpty();
        assertThat(manager.adopt(new Channel0("owned")).getName()).isEqualTo("owned");
    }

    @Test
    void close_후_생성은_IllegalStateException() {
        manager.close();
        manager.close();

        assertThatThrownBy(() -> manager.channel0("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 기본_실행_설정이_생성된_Channel에_적용된다() {
        // given
        ChannelManager continuing = new ChannelManager(
            new ManagerConfig().withDefaultDispatch(new DispatchConfig(FailurePolicy.CONTINUE)));

        // when
        Channel<?> channel = continuing.channel2("pair", String.class, int.class);

        // then
        assertThat(channel.getConfig().failurePolicy()).isEqualTo(FailurePolicy.CONTINUE);
        continuing.close();
    }
}
