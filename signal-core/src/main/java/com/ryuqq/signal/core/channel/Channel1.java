package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

import java.util.function.Consumer;

/**
 * Void channel with one argument.
 *
 * <p>Handlers may take the argument or nothing at all.</p>
 *
 * <pre>
 * Channel1&lt;Integer&gt; onUpdate = new Channel1&lt;&gt;("on-update", int.class);
 * onUpdate.attach(ud -&gt; log.add(ud));
 * onUpdate.attach(() -&gt; ticks.incrementAndGet());
 * onUpdate.trigger(42);
 * </pre>
 *
 * @param <A> argument type
 * @author Signal Team
 * @since 1.0.0
 */
public class Channel1<A> extends Channel<Void> {

    public Channel1(String name, Class<A> typeA) {
        this(name, null, new DispatchConfig(), typeA);
    }

    public Channel1(String name, ChannelRegistry registry, DispatchConfig config, Class<A> typeA) {
        super(name, Signature.ofVoid(typeA), registry, config);
    }

    public SubscriptionKey attach(Consumer<? super A> handler) {
        return attachHandler(Handlers.of(handler));
    }

    public SubscriptionKey attach(Runnable handler) {
        return attachHandler(Handlers.of(handler));
    }

    public void trigger(A a) {
        fire(a);
    }
}
