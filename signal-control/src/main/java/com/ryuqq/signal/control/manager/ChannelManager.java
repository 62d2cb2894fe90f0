package com.ryuqq.signal.control.manager;

import com.ryuqq.signal.core.channel.Channel;
import com.ryuqq.signal.core.channel.Channel0;
import com.ryuqq.signal.core.channel.Channel1;
import com.ryuqq.signal.core.channel.Channel2;
import com.ryuqq.signal.core.channel.Channel3;
import com.ryuqq.signal.core.channel.QueryChannel0;
import com.ryuqq.signal.core.channel.QueryChannel1;
import com.ryuqq.signal.core.channel.QueryChannel2;
import com.ryuqq.signal.core.channel.QueryChannel3;
import com.ryuqq.signal.core.spi.ChannelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이름으로 Channel을 관리하는 ChannelRegistry 구현체.
 *
 * <p>Manager는 Channel을 이름으로 추적합니다. 이름 없는 Channel은
 * {@link ManagerConfig#generatedNamePrefix()} + channelId 이름을 받습니다.</p>
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>팩토리 메서드({@code channel0..3}, {@code query0..3})로 만든 Channel과
 *       {@link #adopt(Channel)}로 넘겨받은 Channel은 이 Manager를 primary로 지정</li>
 *   <li>primary인 Manager는 Channel 파괴 시 알림을 받지 않으며, {@link #close()}에서 직접 파괴</li>
 *   <li>소유한 Channel을 사용자가 직접 파괴하면 다음 조회/등록 시점에 목록에서 제거</li>
 *   <li>그 외 Channel(생성자에 registry로 전달만 된 경우)은 파괴 알림으로 목록에서 제거</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 없음. Channel과 같은 스레드에서 사용합니다.</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class ChannelManager implements ChannelRegistry, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    private final ManagerConfig config;
    private final Map<String, Channel<?>> channels = new LinkedHashMap<>();
    private boolean closed;

    public ChannelManager() {
        this(new ManagerConfig());
    }

    /**
     * @param config Manager 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ChannelManager(ManagerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    // ------------------------------------------------------------------
    // ChannelRegistry
    // ------------------------------------------------------------------

    /**
     * Channel 등록 알림.
     *
     * @throws IllegalArgumentException 같은 이름의 다른 Channel이 이미 있는 경우
     */
    @Override
    public void notifyConstruct(Channel<?> channel) {
        ensureOpen();
        pruneDestroyed();
        String name = nameOf(channel);
        Channel<?> existing = channels.get(name);
        if (existing != null && existing != channel) {
            throw new IllegalArgumentException("Channel name already registered: " + name);
        }
        channels.put(name, channel);
        log.debug("Registered channel '{}' {}", name, channel.getSignature());
    }

    @Override
    public void notifyDestruct(Channel<?> channel) {
        if (channels.values().remove(channel)) {
            log.debug("Forgot destroyed channel '{}'", nameOf(channel));
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * 이름으로 Channel 조회.
     *
     * @param name Channel 이름
     * @return Channel
     * @throws IllegalArgumentException 등록되지 않은 이름인 경우
     */
    public Channel<?> get(String name) {
        pruneDestroyed();
        Channel<?> channel = channels.get(name);
        if (channel == null) {
            throw new IllegalArgumentException("Unknown channel: " + name);
        }
        return channel;
    }

    /**
     * 이름과 Channel 클래스로 조회.
     *
     * <p>예: {@code Channel1<Integer> c = manager.get("hits", Channel1.class);}</p>
     *
     * @param name Channel 이름
     * @param type 기대하는 Channel 클래스
     * @return 지정한 타입으로 캐스팅된 Channel
     * @throws IllegalArgumentException 등록되지 않았거나 클래스가 다른 경우
     */
    public <C> C get(String name, Class<C> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Channel<?> channel = get(name);
        if (!type.isInstance(channel)) {
            throw new IllegalArgumentException(String.format(
                "Channel '%s' is a %s, not a %s",
                name, channel.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(channel);
    }

    public Optional<Channel<?>> find(String name) {
        pruneDestroyed();
        return Optional.ofNullable(channels.get(name));
    }

    public boolean contains(String name) {
        pruneDestroyed();
        return channels.containsKey(name);
    }

    public int size() {
        pruneDestroyed();
        return channels.size();
    }

    /**
     * @return 등록 순서대로의 Channel 이름
     */
    public List<String> names() {
        pruneDestroyed();
        return List.copyOf(channels.keySet());
    }

    /**
     * @return 등록 순서대로의 Channel
     */
    public List<Channel<?>> channels() {
        pruneDestroyed();
        return List.copyOf(channels.values());
    }

    /**
     * Channel 이름 계산.
     *
     * @param channel 대상 Channel
     * @return 이름이 비어 있으면 prefix + channelId, 아니면 Channel 이름
     */
    public String nameOf(Channel<?> channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        return channel.getName().isBlank()
            ? config.generatedNamePrefix() + channel.getChannelId()
            : channel.getName();
    }

    public ManagerConfig getConfig() {
        return config;
    }

    // ------------------------------------------------------------------
    // Ownership
    // ------------------------------------------------------------------

    /**
     * 외부에서 생성한 Channel을 넘겨받아 소유.
     *
     * @param channel 대상 Channel
     * @return 같은 Channel
     * @throws IllegalArgumentException 같은 이름의 다른 Channel이 이미 있는 경우
     */
    public <C extends Channel<?>> C adopt(C channel) {
        ensureOpen();
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        pruneDestroyed();
        Channel<?> existing = channels.get(nameOf(channel));
        if (existing != null && existing != channel) {
            throw new IllegalArgumentException("Channel name already registered: " + nameOf(channel));
        }
        channel.trackBy(this);
        channel.designatePrimary(this);
        return channel;
    }

    /**
     * 모든 Channel 정리.
     *
     * <p>소유한 Channel은 파괴하고, 나머지는 추적만 해제합니다. 여러 번 호출해도 안전합니다.</p>
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        pruneDestroyed();
        int destroyed = 0;
        for (Channel<?> channel : new ArrayList<>(channels.values())) {
            if (channel.getPrimaryRegistry().orElse(null) == this) {
                channel.destroy();
                destroyed++;
            } else {
                channel.untrack(this);
            }
        }
        int released = channels.size() - destroyed;
        channels.clear();
        closed = true;
        log.debug("ChannelManager closed: {} destroyed, {} released", destroyed, released);
    }

    public boolean isClosed() {
        return closed;
    }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public Channel0 channel0(String name) {
        requireFreeName(name);
        return own(new Channel0(name, this, config.defaultDispatch()));
    }

    public <A> Channel1<A> channel1(String name, Class<A> typeA) {
        requireFreeName(name);
        return own(new Channel1<>(name, this, config.defaultDispatch(), typeA));
    }

    public <A, B> Channel2<A, B> channel2(String name, Class<A> typeA, Class<B> typeB) {
        requireFreeName(name);
        return own(new Channel2<>(name, this, config.defaultDispatch(), typeA, typeB));
    }

    public <A, B, C> Channel3<A, B, C> channel3(String name, Class<A> typeA, Class<B> typeB, Class<C> typeC) {
        requireFreeName(name);
        return own(new Channel3<>(name, this, config.defaultDispatch(), typeA, typeB, typeC));
    }

    public <R> QueryChannel0<R> query0(String name, Class<R> returnType) {
        requireFreeName(name);
        return own(new QueryChannel0<>(name, this, config.defaultDispatch(), returnType));
    }

    public <A, R> QueryChannel1<A, R> query1(String name, Class<R> returnType, Class<A> typeA) {
        requireFreeName(name);
        return own(new QueryChannel1<>(name, this, config.defaultDispatch(), returnType, typeA));
    }

    public <A, B, R> QueryChannel2<A, B, R> query2(String name, Class<R> returnType,
                                                   Class<A> typeA, Class<B> typeB) {
        requireFreeName(name);
        return own(new QueryChannel2<>(name, this, config.defaultDispatch(), returnType, typeA, typeB));
    }

    public <A, B, C, R> QueryChannel3<A, B, C, R> query3(String name, Class<R> returnType,
                                                         Class<A> typeA, Class<B> typeB, Class<C> typeC) {
        requireFreeName(name);
        return own(new QueryChannel3<>(name, this, config.defaultDispatch(), returnType, typeA, typeB, typeC));
    }

    private <C extends Channel<?>> C own(C channel) {
        channel.designatePrimary(this);
        return channel;
    }

    private void requireFreeName(String name) {
        ensureOpen();
        pruneDestroyed();
        if (name != null && !name.isBlank() && channels.containsKey(name)) {
            throw new IllegalArgumentException("Channel name already registered: " + name);
        }
    }

    /**
     * 소유한 Channel은 파괴되어도 알림이 오지 않으므로 조회 전에 정리합니다.
     */
    private void pruneDestroyed() {
        channels.entrySet().removeIf(entry -> {
            if (!entry.getValue().isDestroyed()) {
                return false;
            }
            log.debug("Pruned destroyed channel '{}'", entry.getKey());
            return true;
        });
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ChannelManager has been closed");
        }
    }

    @Override
    public String toString() {
        return "ChannelManager{channels=" + channels.keySet() + '}';
    }
}
