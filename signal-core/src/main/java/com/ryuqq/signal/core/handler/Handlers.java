package com.ryuqq.signal.core.handler;

import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 타입이 있는 핸들러를 {@link Handler}로 변환하는 어댑터 빌더.
 *
 * <p>핸들러가 Channel보다 적은 인자를 선언한 경우, 어댑터는 전체 인자 배열을 받아
 * 앞쪽 prefix만 핸들러에 전달하고 뒤쪽 인자는 버립니다.
 * 더 많은 인자를 선언한 핸들러는 Channel의 attach 오버로드가 없으므로 컴파일되지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // Channel 선언: (String, int)
 * Handler&lt;Void&gt; h = Handlers.of((String s) -&gt; log.add(s));
 * h.invoke(new Object[] {"a", 1}); // log.add("a"), 1은 버려짐
 * </pre>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public final class Handlers {

    // Utility class - prevent instantiation
    private Handlers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Handler<Void> of(Runnable fun) {
        requireFun(fun);
        return args -> {
            fun.run();
            return null;
        };
    }

    public static <A> Handler<Void> of(Consumer<? super A> fun) {
        requireFun(fun);
        return args -> {
            fun.accept(Handlers.<A>cast(args[0]));
            return null;
        };
    }

    public static <A, B> Handler<Void> of(BiConsumer<? super A, ? super B> fun) {
        requireFun(fun);
        return args -> {
            fun.accept(Handlers.<A>cast(args[0]), Handlers.<B>cast(args[1]));
            return null;
        };
    }

    public static <A, B, C> Handler<Void> of(TriConsumer<? super A, ? super B, ? super C> fun) {
        requireFun(fun);
        return args -> {
            fun.accept(Handlers.<A>cast(args[0]), Handlers.<B>cast(args[1]), Handlers.<C>cast(args[2]));
            return null;
        };
    }

    public static <R> Handler<R> returning(Supplier<? extends R> fun) {
        requireFun(fun);
        return args -> fun.get();
    }

    public static <A, R> Handler<R> returning(Function<? super A, ? extends R> fun) {
        requireFun(fun);
        return args -> fun.apply(Handlers.<A>cast(args[0]));
    }

    public static <A, B, R> Handler<R> returning(BiFunction<? super A, ? super B, ? extends R> fun) {
        requireFun(fun);
        return args -> fun.apply(Handlers.<A>cast(args[0]), Handlers.<B>cast(args[1]));
    }

    public static <A, B, C, R> Handler<R> returning(TriFunction<? super A, ? super B, ? super C, ? extends R> fun) {
        requireFun(fun);
        return args -> fun.apply(Handlers.<A>cast(args[0]), Handlers.<B>cast(args[1]), Handlers.<C>cast(args[2]));
    }

    /**
     * 타입 소거된 값을 호출 측의 정적 타입으로 변환.
     *
     * <p>값의 타입은 호출 전에 {@link com.ryuqq.signal.core.type.Signature}로 검증되었거나,
     * 타입이 있는 Channel API가 컴파일 시점에 보장한 경우에만 사용합니다.</p>
     *
     * @param value 변환할 값 (null 가능)
     * @param <T> 대상 타입
     * @return 같은 값
     */
    @SuppressWarnings("unchecked")
    public static <T> T cast(Object value) {
        return (T) value;
    }

    private static void requireFun(Object fun) {
        if (fun == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
    }
}
