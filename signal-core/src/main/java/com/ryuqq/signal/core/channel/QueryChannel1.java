package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Returning channel with one argument.
 *
 * <pre>
 * QueryChannel1&lt;Integer, Integer&gt; score = new QueryChannel1&lt;&gt;("score", int.class, int.class);
 * score.attach(x -&gt; x + 1);
 * score.attach(x -&gt; x * 2);
 * score.trigger(5); // [6, 10]
 * </pre>
 *
 * @param <A> argument type
 * @param <R> handler return type
 * @author Signal Team
 * @since 1.0.0
 */
public class QueryChannel1<A, R> extends Channel<R> {

    public QueryChannel1(String name, Class<R> returnType, Class<A> typeA) {
        this(name, null, new DispatchConfig(), returnType, typeA);
    }

    public QueryChannel1(String name, ChannelRegistry registry, DispatchConfig config,
                         Class<R> returnType, Class<A> typeA) {
        super(name, Signature.of(returnType, typeA), registry, config);
    }

    public SubscriptionKey attach(Function<? super A, ? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
    }

    public SubscriptionKey attach(Supplier<? extends R> handler) {
        return attachHandler(Handlers.returning(handler));
    }

    /**
     * @return one result per handler, in position order
     */
    public List<R> trigger(A a) {
        return fireAndCollect(a);
    }
}
