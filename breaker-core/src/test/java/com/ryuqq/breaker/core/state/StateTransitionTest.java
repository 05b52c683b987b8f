package com.ryuqq.breaker.core.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <p><strong>자동 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN</li>
 *   <li>OPEN → HALF_OPEN</li>
 *   <li>HALF_OPEN → CLOSED / OPEN</li>
 * </ul>
 *
 * <p><strong>수동 전이:</strong> 임의 상태 → ISOLATED, 임의 상태 → CLOSED</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========================================
    // Automatic transitions
    // ========================================

    @Test
    void transition_ClosedToOpen_Success() {
        assertEquals(CircuitState.OPEN, StateTransition.transition(CircuitState.CLOSED, CircuitState.OPEN, false));
    }

    @Test
    void transition_OpenToHalfOpen_Success() {
        assertEquals(CircuitState.HALF_OPEN,
            StateTransition.transition(CircuitState.OPEN, CircuitState.HALF_OPEN, false));
    }

    @Test
    void transition_HalfOpenToClosedOrOpen_Success() {
        assertEquals(CircuitState.CLOSED,
            StateTransition.transition(CircuitState.HALF_OPEN, CircuitState.CLOSED, false));
        assertEquals(CircuitState.OPEN,
            StateTransition.transition(CircuitState.HALF_OPEN, CircuitState.OPEN, false));
    }

    @Test
    void transition_ClosedToHalfOpen_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.transition(CircuitState.CLOSED, CircuitState.HALF_OPEN, false)
        );
        assertTrue(exception.getMessage().contains("Invalid circuit transition"));
    }

    @Test
    void transition_OpenToClosedAutomatically_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(CircuitState.OPEN, CircuitState.CLOSED, false));
    }

    @Test
    void transition_AutomaticToIsolated_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(CircuitState.CLOSED, CircuitState.ISOLATED, false));
    }

    @ParameterizedTest
    @EnumSource(value = CircuitState.class, names = {"CLOSED", "OPEN", "HALF_OPEN"})
    void transition_IsolatedAutomatically_ThrowsException(CircuitState target) {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(CircuitState.ISOLATED, target, false));
    }

    // ========================================
    // Manual transitions
    // ========================================

    @ParameterizedTest
    @EnumSource(value = CircuitState.class, names = {"CLOSED", "OPEN", "HALF_OPEN"})
    void transition_ManualIsolate_FromAnyState_Success(CircuitState from) {
        assertEquals(CircuitState.ISOLATED, StateTransition.transition(from, CircuitState.ISOLATED, true));
    }

    @ParameterizedTest
    @EnumSource(value = CircuitState.class, names = {"OPEN", "HALF_OPEN", "ISOLATED"})
    void transition_ManualClose_FromAnyState_Success(CircuitState from) {
        assertEquals(CircuitState.CLOSED, StateTransition.transition(from, CircuitState.CLOSED, true));
    }

    @Test
    void transition_ManualToOpen_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(CircuitState.CLOSED, CircuitState.OPEN, true));
    }

    @ParameterizedTest
    @EnumSource(CircuitState.class)
    void transition_SelfTransition_ThrowsException(CircuitState state) {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(state, state, false));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(state, state, true));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.validate(null, CircuitState.OPEN, false));
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.validate(CircuitState.OPEN, null, false));
    }

    @Test
    void isManual_OnlyIsolated() {
        assertTrue(CircuitState.ISOLATED.isManual());
        assertFalse(CircuitState.OPEN.isManual());
        assertFalse(CircuitState.CLOSED.isManual());
        assertFalse(CircuitState.HALF_OPEN.isManual());
    }

    @Test
    void constructor_ThrowsUnsupportedOperation() throws NoSuchMethodException {
        // Given
        Constructor<StateTransition> constructor = StateTransition.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        // When & Then
        InvocationTargetException exception = assertThrows(InvocationTargetException.class, constructor::newInstance);
        assertInstanceOf(UnsupportedOperationException.class, exception.getCause());
    }
}
