/**
 * Circuit Breaker 계약 테스트 기반.
 *
 * <p>{@link com.ryuqq.breaker.testkit.contract.AbstractCircuitBreakerContractTest}를 상속하면
 * 수동 시계와 이벤트 기록기가 준비된 상태로 시나리오를 검증할 수 있습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.testkit.contract;
