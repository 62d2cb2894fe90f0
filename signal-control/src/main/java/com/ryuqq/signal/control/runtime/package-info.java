/**
 * 이름 기반 연결 및 실행 Facade.
 *
 * <p>{@link com.ryuqq.signal.control.runtime.ChannelControl}은
 * {@link com.ryuqq.signal.control.manager.ChannelManager}와
 * {@link com.ryuqq.signal.control.action.ActionManager}를 묶어 문자열 이름만으로
 * Action을 Channel에 연결하고 실행합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.signal.control.runtime;
