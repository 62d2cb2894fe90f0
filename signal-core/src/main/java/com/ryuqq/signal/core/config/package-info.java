/**
 * Dispatch 설정.
 *
 * @since 1.0.0
 */
package com.ryuqq.signal.core.config;
