/**
 * Circuit Breaker 설정과 BreakDuration 생성기 계약.
 *
 * <p>모든 설정 값은 {@link com.ryuqq.breaker.core.config.CircuitBreakerOptions} 생성 시점에 검증됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.config;
