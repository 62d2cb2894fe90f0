package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

import java.util.List;
import java.util.function.Supplier;

/**
 * Returning channel without arguments.
 *
 * @param <R> handler return type
 * @author Signal Team
 * @since 1.0.0
 */
public class QueryChannel0<R> extends Channel<R> {

    public QueryChannel0(String name, Class<R> returnType) {
        this(name, null, new DispatchConfig(), returnType);
    }

    public QueryChannel0(String name, ChannelRegistry registry, DispatchConfig config, Class<R> returnType) {
        super(name, Signature.of(returnType), registry, config);
    }

    public SubscriptionKey attach(Supplier<? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
    }

    /**
     * @return one result per handler, in position order
     */
    public List<R> trigger() {
        return fireAndCollect();
    }
}
