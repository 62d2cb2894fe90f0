package com.ryuqq.signal.core.type;

import com.ryuqq.signal.core.exception.TypeMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Channel 또는 Action의 선언 시그니처.
 *
 * <p>반환 타입과 인자 타입 목록으로 구성되며, 반환 타입이 {@code void}이면
 * void Channel을 의미합니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>인자 개수는 선언 개수와 정확히 같아야 함</li>
 *   <li>각 인자는 {@link TypeDescriptor#accepts(TypeDescriptor)} 규칙으로 매칭</li>
 *   <li>반환 타입은 동일하거나 축약 형태가 같아야 함</li>
 * </ul>
 *
 * <p>불일치는 호출 측 프로그래밍 오류이므로 항상 {@link TypeMismatchException}으로 즉시 실패합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Signature sig = Signature.of(int.class, String.class, int.class); // int(String, int)
 * sig.verifyArguments(new Object[] {"a", 1});                        // OK
 * sig.verifyArguments(new Object[] {"a", "b"});                      // TypeMismatchException
 * </pre>
 *
 * @param returnType 반환 타입
 * @param parameterTypes 인자 타입 목록 (불변)
 *
 * @author Signal Team
 * @since 1.0.0
 */
public record Signature(
    TypeDescriptor returnType,
    List<TypeDescriptor> parameterTypes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException returnType 또는 parameterTypes가 null인 경우,
     *         또는 인자 타입이 void/null descriptor인 경우
     */
    public Signature {
        if (returnType == null) {
            throw new IllegalArgumentException("returnType cannot be null");
        }
        if (returnType == TypeDescriptor.NULL) {
            throw new IllegalArgumentException("returnType cannot be the null descriptor");
        }
        if (parameterTypes == null) {
            throw new IllegalArgumentException("parameterTypes cannot be null");
        }
        for (TypeDescriptor parameterType : parameterTypes) {
            if (parameterType == null || parameterType == TypeDescriptor.NULL || parameterType.isVoid()) {
                throw new IllegalArgumentException("Invalid parameter type: " + parameterType);
            }
        }
        parameterTypes = List.copyOf(parameterTypes);
    }

    /**
     * 반환 타입이 있는 시그니처 생성.
     *
     * @param returnType 반환 타입
     * @param parameterTypes 인자 타입
     * @return Signature
     */
    public static Signature of(Class<?> returnType, Class<?>... parameterTypes) {
        if (parameterTypes == null) {
            throw new IllegalArgumentException("parameterTypes cannot be null");
        }
        List<TypeDescriptor> descriptors = new ArrayList<>(parameterTypes.length);
        for (Class<?> parameterType : parameterTypes) {
            descriptors.add(TypeDescriptor.of(parameterType));
        }
        return new Signature(TypeDescriptor.of(returnType), descriptors);
    }

    /**
     * void 시그니처 생성.
     *
     * @param parameterTypes 인자 타입
     * @return Signature
     */
    public static Signature ofVoid(Class<?>... parameterTypes) {
        return of(void.class, parameterTypes);
    }

    /**
     * @return void 시그니처 여부
     */
    public boolean isVoid() {
        return returnType.isVoid();
    }

    /**
     * @return 인자 개수
     */
    public int arity() {
        return parameterTypes.size();
    }

    /**
     * 값 배열의 런타임 타입으로 인자 검증.
     *
     * @param args 인자 값
     * @throws TypeMismatchException 개수 또는 타입 불일치
     */
    public void verifyArguments(Object[] args) {
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        List<TypeDescriptor> supplied = new ArrayList<>(args.length);
        for (Object arg : args) {
            supplied.add(TypeDescriptor.ofValue(arg));
        }
        verifyArguments(supplied);
    }

    /**
     * 인자 descriptor 목록 검증.
     *
     * @param supplied 호출 측 인자 descriptor
     * @throws TypeMismatchException 개수 또는 타입 불일치
     */
    public void verifyArguments(List<TypeDescriptor> supplied) {
        if (supplied == null) {
            throw new IllegalArgumentException("supplied cannot be null");
        }
        if (supplied.size() != parameterTypes.size()) {
            throw new TypeMismatchException(String.format(
                "Incorrect number of arguments for %s. Expected: %d; Passed: %d",
                this, parameterTypes.size(), supplied.size()));
        }
        for (int i = 0; i < parameterTypes.size(); i++) {
            TypeDescriptor declared = parameterTypes.get(i);
            TypeDescriptor actual = supplied.get(i);
            if (!declared.accepts(actual)) {
                throw new TypeMismatchException(String.format(
                    "Argument in position %d does not match. Expected: %s; Passed: %s",
                    i, declared.name(), actual.name()), i);
            }
        }
    }

    /**
     * 요청한 반환 타입 검증.
     *
     * @param requested 호출 측이 기대하는 반환 타입
     * @throws TypeMismatchException 반환 타입 불일치
     */
    public void verifyReturnType(TypeDescriptor requested) {
        if (requested == null) {
            throw new IllegalArgumentException("requested cannot be null");
        }
        if (returnType != requested && returnType.reduced() != requested.reduced()) {
            throw new TypeMismatchException(String.format(
                "Incorrect return type for %s. Expected: %s; Passed: %s",
                this, returnType.name(), requested.name()));
        }
    }

    /**
     * 다른 시그니처와 호환되는지 확인 (예외 없음).
     *
     * <p>인자 개수가 같고, 반환 타입과 각 인자 타입의 축약 형태가 같으면 호환됩니다.</p>
     *
     * @param other 비교할 시그니처
     * @return 호환 여부
     */
    public boolean matches(Signature other) {
        if (other == null || other.arity() != arity()) {
            return false;
        }
        if (other.returnType.reduced() != returnType.reduced()) {
            return false;
        }
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (parameterTypes.get(i).reduced() != other.parameterTypes.get(i).reduced()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
            .map(TypeDescriptor::name)
            .collect(Collectors.joining(", ", returnType.name() + "(", ")"));
    }
}
