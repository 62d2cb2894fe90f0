package com.ryuqq.signal.control.manager;

import com.ryuqq.signal.core.config.DispatchConfig;

/**
 * ChannelManager 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>generatedNamePrefix: {@code "signal-"} (이름 없는 Channel은 prefix + channelId)</li>
 *   <li>defaultDispatch: {@link DispatchConfig#DispatchConfig()} (FAIL_FAST)</li>
 * </ul>
 *
 * @param generatedNamePrefix 이름 없는 Channel에 붙일 접두사
 * @param defaultDispatch Manager가 생성하는 Channel의 실행 설정
 *
 * @author Signal Team
 * @since 1.0.0
 */
public record ManagerConfig(
    String generatedNamePrefix,
    DispatchConfig defaultDispatch
) {

    public static final String DEFAULT_NAME_PREFIX = "signal-";

    /**
     * 기본 설정으로 생성.
     */
    public ManagerConfig() {
        this(DEFAULT_NAME_PREFIX, new DispatchConfig());
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 접두사가 비어 있는 경우
     */
    public ManagerConfig {
        if (generatedNamePrefix == null || generatedNamePrefix.isBlank()) {
            throw new IllegalArgumentException("generatedNamePrefix cannot be null or blank");
        }
        if (defaultDispatch == null) {
            throw new IllegalArgumentException("defaultDispatch cannot be null");
        }
    }

    public ManagerConfig withGeneratedNamePrefix(String generatedNamePrefix) {
        return new ManagerConfig(generatedNamePrefix, defaultDispatch);
    }

    public ManagerConfig withDefaultDispatch(DispatchConfig defaultDispatch) {
        return new ManagerConfig(generatedNamePrefix, defaultDispatch);
    }
}
