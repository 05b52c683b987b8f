/**
 * Circuit Breaker 공개 계약과 차단 예외.
 *
 * <p>{@link com.ryuqq.breaker.core.protection.CircuitBreaker}는 보호 대상 호출의 진입점이며,
 * 실제 구현은 {@code breaker-engine} 모듈의 {@code ExecutionGate}가 제공합니다.</p>
 *
 * <h2>예외 체계</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.protection.BrokenCircuitException} - OPEN/HALF_OPEN 차단, 재시도 힌트 포함 가능</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.IsolatedCircuitException} - 수동 격리, 무기한</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.PolicyEvaluationException} - 내부 전용, 호출자에게 전파되지 않음</li>
 * </ul>
 *
 * <p>작업이 던진 예외는 어떤 경우에도 래핑되지 않고 그대로 전파됩니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.breaker.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 허용하고 상태를 추적하지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.protection;
