/**
 * Circuit 상태와 전이 규칙.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.state.CircuitState} - 4가지 Circuit 상태 (enum)</li>
 *   <li>{@link com.ryuqq.breaker.core.state.StateTransition} - 전이 검증</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * CLOSED → OPEN          (statistics)
 * OPEN → HALF_OPEN       (deadline, lazy)
 * HALF_OPEN → CLOSED     (probe success)
 * HALF_OPEN → OPEN       (probe failure)
 * * → ISOLATED           (manual)
 * * → CLOSED             (manual)
 *
 * Forbidden:
 * - ISOLATED → * (statistics)
 * - X → X (no-op is not a transition)
 * </pre>
 *
 * @since 1.0.0
 * @author Breaker Team
 */
package com.ryuqq.breaker.core.state;
