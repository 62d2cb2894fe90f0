/**
 * Signal SDK 사용자를 위한 테스트 지원.
 *
 * <p>{@link com.ryuqq.signal.testkit.contract.InvocationLog}로 핸들러 호출을 기록하고,
 * {@link com.ryuqq.signal.testkit.contract.AbstractChannelContractTest}를 상속해
 * Channel 생성 방식별 계약을 검증합니다.</p>
 */
package com.ryuqq.signal.testkit.contract;
