package com.ryuqq.signal.core.spi;

import com.ryuqq.signal.core.channel.Channel;

/**
 * Channel lifecycle observer SPI.
 *
 * <p>A channel calls these methods on every registry it is told about. Registries hold
 * non-owning references only; they never trigger or mutate the channels they observe.</p>
 *
 * <p><strong>Shared Ownership:</strong></p>
 * <ul>
 *   <li>A channel may be tracked by several registries at once (e.g. a global one and an owner-scoped one)</li>
 *   <li>At most one tracked registry is the <em>primary</em>, the one that owns the channel and initiates its destruction</li>
 *   <li>On destruction the channel notifies every tracked registry <strong>except</strong> the primary</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@code notifyDestruct} must tolerate channels it no longer tracks</li>
 *   <li>No internal locking is expected; dispatch is single-threaded</li>
 * </ul>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public interface ChannelRegistry {

    /**
     * Records a non-owning reference to a newly tracked channel.
     *
     * @param channel the channel that started reporting to this registry
     */
    void notifyConstruct(Channel<?> channel);

    /**
     * Forgets a channel that is being destroyed by someone other than this registry.
     *
     * @param channel the channel being destroyed
     */
    void notifyDestruct(Channel<?> channel);
}
