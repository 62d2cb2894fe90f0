package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;

/**
 * Void channel without arguments.
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class Channel0 extends Channel<Void> {

    public Channel0(String name) {
        this(name, null, new DispatchConfig());
    }

    public Channel0(String name, ChannelRegistry registry, DispatchConfig config) {
        super(name, Signature.ofVoid(), registry, config);
    }

    public SubscriptionKey attach(Runnable handler) {
        return attachHandler(Handlers.of(handler));
    }

    public void trigger() {
        fire();
    }
}
