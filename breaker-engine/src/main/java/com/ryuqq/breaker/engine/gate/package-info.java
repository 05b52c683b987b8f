/**
 * Circuit Breaker 진입점.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * engine/gate (ExecutionGate)
 *   ↓ implements
 * core/protection (CircuitBreaker interface)
 *   ↓ uses
 * engine/state (CircuitStateMachine, TransitionNotifier)
 *   ↓ uses
 * engine/window, engine/policy
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.engine.gate;
