package com.ryuqq.signal.core.type;

import com.ryuqq.signal.core.exception.TypeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Signature 검증 테스트.
 *
 * @author Signal Team
 * @since 1.0.0
 */
class SignatureTest {

    @Test
    void of_CreatesReturningSignature() {
        // When
        Signature signature = Signature.of(int.class, String.class, int.class);

        // Then
        assertFalse(signature.isVoid());
        assertEquals(2, signature.arity());
        assertEquals(TypeDescriptor.of(int.class), signature.returnType());
        assertEquals("int(java.lang.String, int)", signature.toString());
    }

    @Test
    void ofVoid_CreatesVoidSignature() {
        Signature signature = Signature.ofVoid(int.class);

        assertTrue(signature.isVoid());
        assertEquals(1, signature.arity());
        assertEquals("void(int)", signature.toString());
    }

    @Test
    void constructor_NullReturnType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Signature(null, List.of()));
    }

    @Test
    void constructor_VoidParameter_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Signature.ofVoid(void.class));
    }

    @Test
    void parameterTypes_AreImmutable() {
        Signature signature = Signature.ofVoid(int.class);

        assertThrows(UnsupportedOperationException.class,
            () -> signature.parameterTypes().add(TypeDescriptor.of(long.class)));
    }

    @Test
    void verifyArguments_MatchingValues_Passes() {
        Signature signature = Signature.ofVoid(int.class, String.class);

        assertDoesNotThrow(() -> signature.verifyArguments(new Object[] {1, "a"}));
        assertDoesNotThrow(() -> signature.verifyArguments(new Object[] {1, null}));
    }

    @Test
    void verifyArguments_WrongCount_ThrowsTypeMismatch() {
        Signature signature = Signature.ofVoid(int.class, String.class);

        TypeMismatchException exception = assertThrows(
            TypeMismatchException.class,
            () -> signature.verifyArguments(new Object[] {1})
        );
        assertTrue(exception.getMessage().contains("Expected: 2; Passed: 1"));
        assertEquals(-1, exception.getPosition());
    }

    @Test
    void verifyArguments_WrongType_ThrowsTypeMismatchWithPosition() {
        Signature signature = Signature.ofVoid(int.class, String.class);

        TypeMismatchException exception = assertThrows(
            TypeMismatchException.class,
            () -> signature.verifyArguments(new Object[] {1, 2})
        );
        assertEquals(1, exception.getPosition());
        assertTrue(exception.getMessage().contains("java.lang.String"));
    }

    @Test
    void verifyArguments_NullForPrimitive_ThrowsTypeMismatch() {
        Signature signature = Signature.ofVoid(int.class);

        assertThrows(TypeMismatchException.class, () -> signature.verifyArguments(new Object[] {null}));
    }

    @Test
    void verifyReturnType_ReducedMatch_Passes() {
        Signature signature = Signature.of(int.class, int.class);

        assertDoesNotThrow(() -> signature.verifyReturnType(TypeDescriptor.of(Integer.class)));
        assertDoesNotThrow(() -> signature.verifyReturnType(TypeDescriptor.of(int.class)));
    }

    @Test
    void verifyReturnType_Mismatch_ThrowsTypeMismatch() {
        Signature signature = Signature.of(int.class, int.class);

        assertThrows(TypeMismatchException.class,
            () -> signature.verifyReturnType(TypeDescriptor.of(String.class)));
    }

    @Test
    void matches_IgnoresBoxingDifferences() {
        Signature declared = Signature.of(int.class, int.class);

        assertTrue(declared.matches(Signature.of(Integer.class, Integer.class)));
        assertFalse(declared.matches(Signature.of(int.class, long.class)));
        assertFalse(declared.matches(Signature.of(int.class, int.class, int.class)));
        assertFalse(declared.matches(Signature.ofVoid(int.class)));
        assertFalse(declared.matches(null));
    }

    @Test
    void equals_SameDeclaration_AreEqual() {
        assertEquals(Signature.ofVoid(int.class), Signature.ofVoid(int.class));
        assertNotEquals(Signature.ofVoid(int.class), Signature.ofVoid(Integer.class));
    }
}
