package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.config.FailurePolicy;
import com.ryuqq.signal.core.exception.HandlerFailureException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 핸들러 실패 정책 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
class ChannelFailurePolicyTest {

    @Test
    void failFast_StopsAtFirstFailureAndPropagatesUnwrapped() {
        // Given
        Channel1<Integer> channel = new Channel1<>("fail-fast", int.class);
        List<String> log = new ArrayList<>();
        IllegalStateException boom = new IllegalStateException("boom");
        channel.attach(x -> log.add("a"));
        channel.attach(x -> { throw boom; });
        channel.attach(x -> log.add("c"));

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> channel.trigger(1));

        // Then
        assertSame(boom, thrown);
        assertEquals(List.of("a"), log);
    }

    @Test
    void continue_RunsEveryHandlerAndAggregates() {
        // Given
        DispatchConfig config = new DispatchConfig(FailurePolicy.CONTINUE);
        Channel1<Integer> channel = new Channel1<>("continue", null, config, int.class);
        List<String> log = new ArrayList<>();
        channel.attach(x -> { throw new IllegalArgumentException("first"); });
        channel.attach(x -> log.add("b"));
        channel.attach(x -> { throw new IllegalStateException("third"); });

        // When
        HandlerFailureException thrown = assertThrows(HandlerFailureException.class, () -> channel.trigger(1));

        // Then
        assertEquals(List.of("b"), log);
        assertEquals("continue", thrown.getChannelName());
        assertEquals(2, thrown.getFailures().size());
        assertEquals(0, thrown.getFailures().get(0).position());
        assertEquals(2, thrown.getFailures().get(1).position());
        assertEquals("first", thrown.getCause().getMessage());
        assertEquals("third", thrown.getSuppressed()[0].getMessage());
    }

    @Test
    void continue_NoFailures_ReturnsAllResults() {
        DispatchConfig config = new DispatchConfig().withFailurePolicy(FailurePolicy.CONTINUE);
        QueryChannel1<Integer, Integer> channel = new QueryChannel1<>("ok", null, config, int.class, int.class);
        channel.attach(x -> x);
        channel.attach(x -> -x);

        assertEquals(List.of(3, -3), channel.trigger(3));
    }
}
