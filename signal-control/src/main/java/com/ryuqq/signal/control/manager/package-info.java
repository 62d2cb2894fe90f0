/**
 * Channel 소유 및 이름 기반 조회.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.signal.control.manager.ChannelManager} - 이름으로 Channel을 추적하는 ChannelRegistry</li>
 *   <li>{@link com.ryuqq.signal.control.manager.ManagerConfig} - 이름 접두사와 기본 실행 설정</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.signal.control.manager;
