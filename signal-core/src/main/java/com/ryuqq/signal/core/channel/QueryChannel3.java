package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.handler.TriFunction;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Returning channel with three arguments.
 *
 * @param <A> first argument type
 * @param <B> second argument type
 * @param <C> third argument type
 * @param <R> handler return type
 * @author Signal Team
 * @since 1.0.0
 */
public class QueryChannel3<A, B, C, R> extends Channel<R> {

    public QueryChannel3(String name, Class<R> returnType, Class<A> typeA, Class<B> typeB, Class<C> typeC) {
        this(name, null, new DispatchConfig(), returnType, typeA, typeB, typeC);
    }

    public QueryChannel3(String name, ChannelRegistry registry, DispatchConfig config,
                         Class<R> returnType, Class<A> typeA, Class<B> typeB, Class<C> typeC) {
        super(name, Signature.of(returnType, typeA, typeB, typeC), registry, config);
    }

    public SubscriptionKey attach(TriFunction<? super A, ? super B, ? super C, ? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
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

    public List<R> trigger(A a, B b, C c) {
        return fireAndCollect(a, b, c);
    }
}
