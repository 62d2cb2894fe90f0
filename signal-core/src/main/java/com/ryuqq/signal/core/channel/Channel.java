package com.ryuqq.signal.core.channel;

import com.ryuqq.signal.core.action.Action;
import com.ryuqq.signal.core.config.DispatchConfig;
import com.ryuqq.signal.core.exception.SignatureMismatchException;
import com.ryuqq.signal.core.exception.TypeMismatchException;
import com.ryuqq.signal.core.exception.UnknownKeyException;
import com.ryuqq.signal.core.handler.Handler;
import com.ryuqq.signal.core.handler.HandlerSet;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.result.DispatchResult;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import com.ryuqq.signal.core.type.Signature;
import com.ryuqq.signal.core.type.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class of every channel, the type-erased view.
 *
 * <p>A channel owns an ordered {@link HandlerSet}, a name used for diagnostics, and a
 * mapping from {@link SubscriptionKey} to the handler's current position. Channels of
 * different signatures can be stored together as {@code Channel<?>} and triggered through
 * {@link #baseTrigger(Object...)}, {@link #baseQuery(Class, Object...)} or
 * {@link #dispatch(Object...)}, all of which verify the supplied values against the declared
 * {@link Signature} before any unchecked cast.</p>
 *
 * <p><strong>Typed Variants:</strong></p>
 * <ul>
 *   <li>{@link Channel0} .. {@link Channel3}: void channels of arity 0 to 3</li>
 *   <li>{@link QueryChannel0} .. {@link QueryChannel3}: channels whose handlers return {@code R}</li>
 * </ul>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>Key positions are exactly {@code 0..size-1}, one key per position</li>
 *   <li>Sequence numbers strictly increase per channel and are never reused</li>
 *   <li>Invocation order is position order (registration order, compacted after removals)</li>
 * </ul>
 *
 * <p><strong>Reentrancy:</strong> a trigger pass iterates a snapshot taken when the pass starts.
 * Attach/remove from inside a handler update keys and positions immediately and take
 * effect on the next pass.</p>
 *
 * <p><strong>Concurrency:</strong> single-threaded. Callers sharing a channel across threads
 * must synchronize attach/remove/trigger externally.</p>
 *
 * @param <R> handler return type ({@link Void} for void channels)
 * @author Signal Team
 * @since 1.0.0
 */
public abstract class Channel<R> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Channel.class);

    private static final AtomicLong NEXT_CHANNEL_ID = new AtomicLong();

    private final String name;
    private final long channelId;
    private final Signature signature;
    private final DispatchConfig config;
    private final HandlerSet<R> handlers;
    private final NavigableMap<SubscriptionKey, Integer> keyToPosition = new TreeMap<>();
    private final List<ChannelRegistry> registries = new ArrayList<>();

    private ChannelRegistry primaryRegistry;
    private long nextSequence;
    private boolean destroyed;

    /**
     * Creates a channel and, when a registry is given, starts reporting to it.
     *
     * @param name diagnostic name (null is treated as empty)
     * @param signature declared return and parameter types
     * @param registry registry to notify, or null
     * @param config dispatch configuration
     * @throws IllegalArgumentException if signature or config is null
     */
    protected Channel(String name, Signature signature, ChannelRegistry registry, DispatchConfig config) {
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name == null ? "" : name;
        this.channelId = NEXT_CHANNEL_ID.incrementAndGet();
        this.signature = signature;
        this.config = config;
        this.handlers = new HandlerSet<>(this.name);

        if (registry != null) {
            trackBy(registry);
        }
    }

    // ------------------------------------------------------------------
    // Attach / remove
    // ------------------------------------------------------------------

    /**
     * Appends an erased handler and allocates its key.
     *
     * @param handler handler that accepts this channel's full argument list
     * @return the new key
     */
    protected final SubscriptionKey attachHandler(Handler<R> handler) {
        ensureAlive();
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        SubscriptionKey key = SubscriptionKey.of(channelId, ++nextSequence);
        int position = handlers.add(handler);
        keyToPosition.put(key, position);
        log.debug("Attached {} to '{}' at position {}", key, name, position);
        return key;
    }

    /**
     * Attaches an {@link Action} after checking its signature against this channel's.
     *
     * @param action the action to attach
     * @return the new key
     * @throws SignatureMismatchException if the action's signature does not match
     * @throws IllegalArgumentException if action is null
     */
    public final SubscriptionKey attach(Action<?> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (!testMatch(action)) {
            throw new SignatureMismatchException(action.getName(), action.getSignature(), name, signature);
        }
        return attachHandler(Handlers.<Handler<R>>cast(action.getHandler()));
    }

    /**
     * Checks whether an action could be attached, without attaching it.
     *
     * @param action the action to probe
     * @return true if the action's signature matches this channel's
     */
    public final boolean testMatch(Action<?> action) {
        return action != null && signature.matches(action.getSignature());
    }

    /**
     * Removes one handler and shifts every later position down by one.
     *
     * @param key key returned by attach
     * @throws UnknownKeyException if the key is not currently registered here
     */
    public final void remove(SubscriptionKey key) {
        ensureAlive();
        Integer position = key == null ? null : keyToPosition.remove(key);
        if (position == null) {
            throw new UnknownKeyException(key, name);
        }
        handlers.remove(position);
        for (Map.Entry<SubscriptionKey, Integer> entry : keyToPosition.entrySet()) {
            if (entry.getValue() > position) {
                entry.setValue(entry.getValue() - 1);
            }
        }
        log.debug("Removed {} from '{}' (was position {})", key, name, position);
    }

    /**
     * Removes every handler, one key at a time, lowest key first.
     */
    public final void clear() {
        ensureAlive();
        while (!keyToPosition.isEmpty()) {
            remove(keyToPosition.firstKey());
        }
    }

    // ------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------

    /**
     * @param key a subscription key
     * @return current invocation rank of the key's handler
     * @throws UnknownKeyException if the key is not currently registered here
     */
    public final int getPriority(SubscriptionKey key) {
        Integer position = key == null ? null : keyToPosition.get(key);
        if (position == null) {
            throw new UnknownKeyException(key, name);
        }
        return position;
    }

    public final boolean has(SubscriptionKey key) {
        return key != null && keyToPosition.containsKey(key);
    }

    /**
     * @return registered keys in ascending key order
     */
    public final List<SubscriptionKey> keys() {
        return List.copyOf(keyToPosition.keySet());
    }

    public final String getName() {
        return name;
    }

    public final long getChannelId() {
        return channelId;
    }

    public final Signature getSignature() {
        return signature;
    }

    public final DispatchConfig getConfig() {
        return config;
    }

    public final int getNumArgs() {
        return signature.arity();
    }

    public final int getNumActions() {
        return handlers.size();
    }

    public final boolean isDestroyed() {
        return destroyed;
    }

    // ------------------------------------------------------------------
    // Triggering
    // ------------------------------------------------------------------

    /**
     * Runs every handler, discarding results. Typed subclasses call this after compile-time checks.
     */
    protected final void fire(Object... args) {
        ensureAlive();
        handlers.run(args, config.failurePolicy());
    }

    /**
     * Runs every handler and collects one result per handler, in position order.
     */
    protected final List<R> fireAndCollect(Object... args) {
        ensureAlive();
        return handlers.collect(args, config.failurePolicy());
    }

    /**
     * Erased trigger for void channels.
     *
     * @param args argument values in declared order
     * @throws TypeMismatchException if this channel is not void, or the arguments do not match
     */
    public final void baseTrigger(Object... args) {
        if (!signature.isVoid()) {
            throw new TypeMismatchException(String.format(
                "Channel '%s' %s returns values; use baseQuery", name, signature));
        }
        signature.verifyArguments(args);
        fire(args);
    }

    /**
     * Erased trigger for channels whose handlers return values.
     *
     * @param returnType expected handler return type
     * @param args argument values in declared order
     * @param <T> expected handler return type
     * @return one result per handler, in position order
     * @throws TypeMismatchException if the return type or the arguments do not match
     */
    public final <T> List<T> baseQuery(Class<T> returnType, Object... args) {
        if (returnType == null) {
            throw new IllegalArgumentException("returnType cannot be null");
        }
        signature.verifyReturnType(TypeDescriptor.of(returnType));
        signature.verifyArguments(args);
        return Handlers.<List<T>>cast(fireAndCollect(args));
    }

    /**
     * Erased trigger returning {@link DispatchResult}: {@code Unit} for void channels,
     * {@code Values} otherwise.
     *
     * @param args argument values in declared order
     * @return dispatch result
     * @throws TypeMismatchException if the arguments do not match
     */
    public final DispatchResult<R> dispatch(Object... args) {
        signature.verifyArguments(args);
        if (signature.isVoid()) {
            fire(args);
            return DispatchResult.unit();
        }
        return DispatchResult.values(fireAndCollect(args));
    }

    // ------------------------------------------------------------------
    // Registries and lifecycle
    // ------------------------------------------------------------------

    /**
     * Starts reporting lifecycle events to a registry. Tracking the same registry twice is a no-op.
     *
     * @param registry registry to notify
     */
    public final void trackBy(ChannelRegistry registry) {
        ensureAlive();
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (registries.contains(registry)) {
            return;
        }
        registries.add(registry);
        registry.notifyConstruct(this);
        log.debug("Channel '{}' (id {}) tracked by {}", name, channelId, registry);
    }

    /**
     * Stops reporting to a registry. Clears the primary designation if it was the primary.
     *
     * @param registry registry to forget
     * @return true if the registry was tracking this channel
     */
    public final boolean untrack(ChannelRegistry registry) {
        if (registry == primaryRegistry) {
            primaryRegistry = null;
        }
        return registries.remove(registry);
    }

    /**
     * Marks the registry that owns this channel. The primary is not notified on destruction,
     * since it is the one destroying the channel.
     *
     * @param registry a registry already tracking this channel
     * @throws IllegalArgumentException if the registry does not track this channel
     */
    public final void designatePrimary(ChannelRegistry registry) {
        if (registry == null || !registries.contains(registry)) {
            throw new IllegalArgumentException("primary registry must already track channel '" + name + "'");
        }
        this.primaryRegistry = registry;
    }

    public final Optional<ChannelRegistry> getPrimaryRegistry() {
        return Optional.ofNullable(primaryRegistry);
    }

    public final List<ChannelRegistry> getRegistries() {
        return List.copyOf(registries);
    }

    /**
     * Removes all handlers and notifies every tracked registry except the primary.
     * Destroying twice is a no-op. Afterwards attach, remove and trigger fail.
     */
    public final void destroy() {
        if (destroyed) {
            return;
        }
        clear();
        destroyed = true;
        for (ChannelRegistry registry : List.copyOf(registries)) {
            if (registry != primaryRegistry) {
                registry.notifyDestruct(this);
            }
        }
        registries.clear();
        primaryRegistry = null;
        log.debug("Channel '{}' (id {}) destroyed", name, channelId);
    }

    @Override
    public final void close() {
        destroy();
    }

    private void ensureAlive() {
        if (destroyed) {
            throw new IllegalStateException("Channel '" + name + "' has been destroyed");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + " #" + channelId + " " + signature
            + ", actions=" + handlers.size() + '}';
    }
}
