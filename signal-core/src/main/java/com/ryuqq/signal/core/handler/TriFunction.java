package com.ryuqq.signal.core.handler;

/**
 * 인자 3개를 받아 값을 반환하는 핸들러.
 *
 * @author Signal Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TriFunction<A, B, C, R> {

    R apply(A a, B b, C c);
}
