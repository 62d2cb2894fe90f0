package com.ryuqq.signal.core.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 런타임에 비교 가능한 타입 식별자.
 *
 * <p>TypeDescriptor는 프로세스 전역에서 타입마다 하나만 생성(intern)되며,
 * 타입 소거(type-erased) 경로로 Channel을 호출할 때 인자/반환 타입이
 * 선언과 일치하는지 검증하는 데 사용됩니다.</p>
 *
 * <p><strong>축약 형태 (reduced):</strong></p>
 * <ul>
 *   <li>래퍼 타입은 대응하는 primitive 타입으로 축약 ({@code Integer → int}, {@code Void → void})</li>
 *   <li>그 외 타입은 자기 자신으로 축약</li>
 * </ul>
 *
 * <p><strong>매칭 규칙 ({@link #accepts(TypeDescriptor)}):</strong></p>
 * <ul>
 *   <li>동일한 descriptor</li>
 *   <li>축약 형태가 동일 ({@code int} 선언에 {@code Integer} 값)</li>
 *   <li>참조 타입 선언은 하위 타입 값을 허용 ({@code CharSequence} 선언에 {@code String} 값)</li>
 *   <li>{@link #NULL}은 primitive가 아닌 선언 타입과 매칭</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가, 동일 타입은 항상 동일 인스턴스</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public final class TypeDescriptor implements Comparable<TypeDescriptor> {

    private static final Map<Class<?>, TypeDescriptor> INTERNED = new ConcurrentHashMap<>();
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private static final Map<Class<?>, Class<?>> WRAPPER_TO_PRIMITIVE = Map.of(
        Boolean.class, boolean.class,
        Byte.class, byte.class,
        Character.class, char.class,
        Short.class, short.class,
        Integer.class, int.class,
        Long.class, long.class,
        Float.class, float.class,
        Double.class, double.class,
        Void.class, void.class
    );

    /**
     * null 값의 descriptor. primitive가 아닌 모든 선언 타입과 매칭됩니다.
     */
    public static final TypeDescriptor NULL = new TypeDescriptor(0, null);

    /**
     * {@code void} descriptor.
     */
    public static final TypeDescriptor VOID = of(void.class);

    private final int id;
    private final Class<?> type;

    private TypeDescriptor(int id, Class<?> type) {
        this.id = id;
        this.type = type;
    }

    /**
     * 타입의 descriptor 조회 (없으면 생성).
     *
     * @param type 대상 타입
     * @return 해당 타입의 유일한 TypeDescriptor
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static TypeDescriptor of(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return INTERNED.computeIfAbsent(type, t -> new TypeDescriptor(NEXT_ID.incrementAndGet(), t));
    }

    /**
     * 값의 런타임 타입 descriptor.
     *
     * @param value 값 (null 가능)
     * @return value가 null이면 {@link #NULL}, 아니면 value 클래스의 descriptor
     */
    public static TypeDescriptor ofValue(Object value) {
        return value == null ? NULL : of(value.getClass());
    }

    /**
     * 축약 형태 조회.
     *
     * @return 래퍼 타입이면 primitive descriptor, 아니면 자기 자신
     */
    public TypeDescriptor reduced() {
        if (type == null) {
            return this;
        }
        Class<?> primitive = WRAPPER_TO_PRIMITIVE.get(type);
        return primitive == null ? this : of(primitive);
    }

    /**
     * 선언 타입(this)이 전달된 타입을 받아들이는지 확인.
     *
     * @param supplied 호출 측에서 전달한 descriptor
     * @return 매칭 여부
     * @throws IllegalArgumentException supplied가 null인 경우
     */
    public boolean accepts(TypeDescriptor supplied) {
        if (supplied == null) {
            throw new IllegalArgumentException("supplied descriptor cannot be null");
        }
        if (this == supplied) {
            return true;
        }
        if (supplied == NULL) {
            return type != null && !type.isPrimitive();
        }
        if (reduced() == supplied.reduced()) {
            return true;
        }
        return type != null && !type.isPrimitive()
            && !supplied.type.isPrimitive() && type.isAssignableFrom(supplied.type);
    }

    /**
     * @return primitive 타입 여부 ({@code void} 포함)
     */
    public boolean isPrimitive() {
        return type != null && type.isPrimitive();
    }

    /**
     * @return {@code void} 또는 {@code Void} 여부
     */
    public boolean isVoid() {
        return reduced() == VOID;
    }

    /**
     * @return 대상 타입 ({@link #NULL}이면 null)
     */
    public Class<?> type() {
        return type;
    }

    /**
     * @return 진단용 타입 이름
     */
    public String name() {
        return type == null ? "null" : type.getTypeName();
    }

    /**
     * 생성 순서(intern id) 기준 비교.
     */
    @Override
    public int compareTo(TypeDescriptor other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeDescriptor that = (TypeDescriptor) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return name();
    }
}
