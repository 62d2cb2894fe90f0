package com.ryuqq.signal.core.action;

import com.ryuqq.signal.core.handler.Handler;
import com.ryuqq.signal.core.handler.Handlers;
import com.ryuqq.signal.core.handler.TriConsumer;
import com.ryuqq.signal.core.handler.TriFunction;
import com.ryuqq.signal.core.type.Signature;

import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 이름과 시그니처가 붙은 핸들러 묶음.
 *
 * <p>Action은 Channel 타입을 모르는 API 경계를 넘어 핸들러를 전달할 때 사용합니다.
 * Channel은 attach 시점에 Action의 시그니처를 런타임에 검사하고,
 * 일치하면 풀어서 등록합니다.</p>
 *
 * <p>Action 자체는 인자 보정(adaptation)을 하지 않습니다.
 * 시그니처는 팩토리 메서드에 전달한 타입과 정확히 같습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Action&lt;Consumer&lt;Integer&gt;&gt; record = Action.of("record", int.class, log::add);
 * Channel1&lt;Integer&gt; onUpdate = new Channel1&lt;&gt;("on-update", int.class);
 * if (onUpdate.testMatch(record)) {
 *     SubscriptionKey key = onUpdate.attach(record);
 * }
 * </pre>
 *
 * @param <F> 원본 callable 타입
 * @author Signal Team
 * @since 1.0.0
 */
public final class Action<F> {

    private final String name;
    private final Signature signature;
    private final F fun;
    private final Handler<?> handler;

    private Action(String name, Signature signature, F fun, Handler<?> handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.signature = signature;
        this.fun = fun;
        this.handler = handler;
    }

    public static Action<Runnable> of(String name, Runnable fun) {
        return new Action<>(name, Signature.ofVoid(), fun, Handlers.of(fun));
    }

    public static <A> Action<Consumer<A>> of(String name, Class<A> typeA, Consumer<A> fun) {
        return new Action<>(name, Signature.ofVoid(typeA), fun, Handlers.of(fun));
    }

    public static <A, B> Action<BiConsumer<A, B>> of(String name, Class<A> typeA, Class<B> typeB,
                                                     BiConsumer<A, B> fun) {
        return new Action<>(name, Signature.ofVoid(typeA, typeB), fun, Handlers.of(fun));
    }

    public static <A, B, C> Action<TriConsumer<A, B, C>> of(String name, Class<A> typeA, Class<B> typeB,
                                                             Class<C> typeC, TriConsumer<A, B, C> fun) {
        return new Action<>(name, Signature.ofVoid(typeA, typeB, typeC), fun, Handlers.of(fun));
    }

    public static <R> Action<Supplier<R>> returning(String name, Class<R> returnType, Supplier<R> fun) {
        return new Action<>(name, Signature.of(returnType), fun, Handlers.returning(fun));
    }

    public static <A, R> Action<Function<A, R>> returning(String name, Class<R> returnType, Class<A> typeA,
                                                          Function<A, R> fun) {
        return new Action<>(name, Signature.of(returnType, typeA), fun, Handlers.returning(fun));
    }

    public static <A, B, R> Action<BiFunction<A, B, R>> returning(String name, Class<R> returnType,
                                                                  Class<A> typeA, Class<B> typeB,
                                                                  BiFunction<A, B, R> fun) {
        return new Action<>(name, Signature.of(returnType, typeA, typeB), fun, Handlers.returning(fun));
    }

    public static <A, B, C, R> Action<TriFunction<A, B, C, R>> returning(String name, Class<R> returnType,
                                                                         Class<A> typeA, Class<B> typeB,
                                                                         Class<C> typeC,
                                                                         TriFunction<A, B, C, R> fun) {
        return new Action<>(name, Signature.of(returnType, typeA, typeB, typeC), fun, Handlers.returning(fun));
    }

    public String getName() {
        return name;
    }

    public Signature getSignature() {
        return signature;
    }

    /**
     * @return 원본 callable (다른 Channel에 직접 attach할 때 사용)
     */
    public F getFun() {
        return fun;
    }

    /**
     * @return Channel 저장용 타입 소거 형태
     */
    public Handler<?> getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return "Action{" + name + " " + signature + '}';
    }
}
