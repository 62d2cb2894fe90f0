package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.handler.TriConsumer;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Void channel with three arguments. Handlers may take any leading prefix of them.
 *
 * @param <A> first argument type
 * @param <B> second argument type
 * @param <C> third argument type
 * @author Signal Team
 * @since 1.0.0
 */
public class Channel3<A, B, C> extends Channel<Void> {

    public Channel3(String name, Class<A> typeA, Class<B> typeB, Class<C> typeC) {
        this(name, null, new DispatchConfig(), typeA, typeB, typeC);
    }

    public Channel3(String name, ChannelRegistry registry, DispatchConfig config,
                    Class<A> typeA, Class<B> typeB, Class<C> typeC) {
        super(name, Signature.ofVoid(typeA, typeB, typeC), registry, config);
    }

    public SubscriptionKey attach(TriConsumer<? super A, ? super B, ? super C> handler) {
        return attachHandler(Handlers.of(handler));
    }

    public SubscriptionKey attach(BiConsumer<? super A, ? super B> handler) {
        return attachHandler(Handlers.of(handler));
    }

    public SubscriptionKey attach(Consumer<? super A> handler) {
        return attachHandler(Handlers.of(handler));
    }

    public SubscriptionKey attach(Runnable handler) {
        return attachHandler(Handlers.of(handler));
    }

    public void trigger(A a, B b, C c) {
        fire(a, b, c);
    }
}
