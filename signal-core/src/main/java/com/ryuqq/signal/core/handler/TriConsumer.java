package com.ryuqq.signal.core.handler;

/**
 * 인자 3개를 받는 void 핸들러.
 *
 * @author Signal Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TriConsumer<A, B, C> {

    void accept(A a, B b, C c);
}
