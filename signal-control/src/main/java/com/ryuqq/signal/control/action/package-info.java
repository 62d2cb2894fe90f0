/**
 * 이름 기반 Action 저장소.
 *
 * @since 1.0.0
 */
package com.ryuqq.signal.control.action;
