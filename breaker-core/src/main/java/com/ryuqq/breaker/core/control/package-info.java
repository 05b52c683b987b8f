/**
 * 외부에서 Circuit Breaker를 제어·조회하는 핸들.
 *
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.control.CircuitBreakerManualControl} - 격리/복구 (여러 Circuit Breaker 공유 가능)</li>
 *   <li>{@link com.ryuqq.breaker.core.control.CircuitBreakerStateProvider} - 상태 조회 (Circuit Breaker 1개 전용)</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.control;
