package com.ryuqq.signal.testkit.contract;

import com.ryuqq.signal.core.channel.Channel1;
import com.ryuqq.signal.core.channel.QueryChannel1;

/**
 * 직접 생성한 Channel에 대한 계약 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
class DirectChannelContractTest extends AbstractChannelContractTest {

    @Override
    protected Channel1<Integer> createVoidChannel(String name) {
        return new Channel1<>(name, int.class);
    }

    @Override
    protected QueryChannel1<Integer, Integer> createQueryChannel(String name) {
        return new QueryChannel1<>(name, int.class, int.class);
    }
}
