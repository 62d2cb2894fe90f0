package com.ryuqq.signal.testkit.contract;

import com.ryuqq.signal.core.channel.Channel;
import com.ryuqq.signal.core.spi.ChannelRegistry;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 알림을 기록하는 테스트용 ChannelRegistry 구현체.
 *
 * <p>생성/파괴 알림을 순서대로 기록하고, 현재 살아 있는 Channel 집합을 유지합니다.</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class RecordingRegistry implements ChannelRegistry {

    private final List<Event> events = new CopyOnWriteArrayList<>();
    private final Set<Channel<?>> live = ConcurrentHashMap.newKeySet();

    @Override
    public void notifyConstruct(Channel<?> channel) {
        events.add(new Event(EventType.CONSTRUCT, channel));
        live.add(channel);
    }

    @Override
    public void notifyDestruct(Channel<?> channel) {
        events.add(new Event(EventType.DESTRUCT, channel));
        live.remove(channel);
    }

    /**
     * @return 기록된 알림 (발생 순서)
     */
    public List<Event> events() {
        return List.copyOf(events);
    }

    public boolean isTracking(Channel<?> channel) {
        return live.contains(channel);
    }

    public int liveCount() {
        return live.size();
    }

    public long destructCount(Channel<?> channel) {
        return events.stream()
            .filter(e -> e.type() == EventType.DESTRUCT && e.channel() == channel)
            .count();
    }

    public void clear() {
        events.clear();
        live.clear();
    }

    /**
     * 알림 종류.
     */
    public enum EventType {
        CONSTRUCT,
        DESTRUCT
    }

    /**
     * 알림 1건.
     *
     * @param type 알림 종류
     * @param channel 대상 Channel
     */
    public record Event(EventType type, Channel<?> channel) {
    }
}
