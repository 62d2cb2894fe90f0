package com.ryuqq.signal.core.key;

/**
 * Channel에 등록된 핸들러 하나를 식별하는 키.
 *
 * <p>(channelId, sequenceId) 쌍으로 구성되며, 사전식 순서로 정렬됩니다.
 * sequenceId가 0이면 비활성(등록되지 않음) 키입니다. 두 값 모두 {@code long}이므로
 * 부호 없는 32비트 범위 전체를 표현합니다.</p>
 *
 * <p><strong>수명:</strong></p>
 * <ul>
 *   <li>핸들러를 attach할 때 Channel이 발급</li>
 *   <li>해당 Channel과 등록이 존재하는 동안에만 유효</li>
 *   <li>핸들러가 제거되면 stale 상태가 되며 재사용하면 안 됨</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public final class SubscriptionKey implements Comparable<SubscriptionKey> {

    /**
     * 비활성 키. 어떤 등록과도 일치하지 않습니다.
     */
    public static final SubscriptionKey INACTIVE = new SubscriptionKey(0, 0);

    private final long channelId;
    private final long sequenceId;

    private SubscriptionKey(long channelId, long sequenceId) {
        if (channelId < 0) {
            throw new IllegalArgumentException("channelId cannot be negative, but was: " + channelId);
        }
        if (sequenceId < 0) {
            throw new IllegalArgumentException("sequenceId cannot be negative, but was: " + sequenceId);
        }
        this.channelId = channelId;
        this.sequenceId = sequenceId;
    }

    /**
     * SubscriptionKey 생성.
     *
     * @param channelId Channel ID
     * @param sequenceId Channel 내 순번 (0이면 비활성)
     * @return SubscriptionKey 인스턴스
     * @throws IllegalArgumentException 음수 값인 경우
     */
    public static SubscriptionKey of(long channelId, long sequenceId) {
        return new SubscriptionKey(channelId, sequenceId);
    }

    /**
     * @return 활성 키 여부 (sequenceId &gt; 0)
     */
    public boolean isActive() {
        return sequenceId > 0;
    }

    public long getChannelId() {
        return channelId;
    }

    public long getSequenceId() {
        return sequenceId;
    }

    @Override
    public int compareTo(SubscriptionKey other) {
        int byChannel = Long.compare(channelId, other.channelId);
        return byChannel != 0 ? byChannel : Long.compare(sequenceId, other.sequenceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionKey that = (SubscriptionKey) o;
        return channelId == that.channelId && sequenceId == that.sequenceId;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(channelId) + Long.hashCode(sequenceId);
    }

    @Override
    public String toString() {
        return "SubscriptionKey{" + channelId + ":" + sequenceId + '}';
    }
}
