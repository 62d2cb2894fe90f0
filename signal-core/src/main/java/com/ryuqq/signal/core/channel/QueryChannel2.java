package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Returning channel with two arguments.
 *
 * @param <A> first argument type
 * @param <B> second argument type
 * @param <R> handler return type
 * @author Signal Team
 * @since 1.0.0
 */
public class QueryChannel2<A, B, R> extends Channel<R> {

    public QueryChannel2(String name, Class<R> returnType, Class<A> typeA, Class<B> typeB) {
        this(name, null, new DispatchConfig(), returnType, typeA, typeB);
    }

    public QueryChannel2(String name, ChannelRegistry registry, DispatchConfig config,
                         Class<R> returnType, Class<A> typeA, Class<B> typeB) {
        super(name, Signature.of(returnType, typeA, typeB), registry, config);
    }

    public SubscriptionKey attach(BiFunction<? super A, ? super B, ? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
    }

    public SubscriptionKey attach(Function<? super A, ? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
    }

    public SubscriptionKey attach(Supplier<? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
    }

    public List<R> trigger(A a, B b) {
        return fireAndCollect(a, b);
    }
}
