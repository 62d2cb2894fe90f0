package com.ryuqq.signal.core.exception;

import com.ryuqq.signal.core.key.SubscriptionKey;

/**
 * Channel에 등록되어 있지 않은 SubscriptionKey로 조회/제거를 시도할 때 발생합니다.
 *
 * <p>이미 제거된 키를 다시 사용하는 경우도 포함됩니다.</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class UnknownKeyException extends SignalException {

    private final SubscriptionKey key;

    public UnknownKeyException(SubscriptionKey key, String channelName) {
        super("Key " + key + " is not registered on channel '" + channelName + "'");
        this.key = key;
    }

    public SubscriptionKey getKey() {
        return key;
    }
}
