/**
 * 전이 이벤트 계약.
 *
 * <p>이벤트 전송(exporter)은 이 모듈의 범위가 아니며, {@link com.ryuqq.breaker.core.event.TransitionListener}
 * 구현체가 원하는 싱크로 전달합니다.</p>
 *
 * <h2>이벤트</h2>
 * <pre>
 * CIRCUIT_CLOSED       INFO     lastOutcome = 프로브 결과 (수동이면 없음)
 * CIRCUIT_OPENED       ERROR    lastOutcome = 실패 결과, breakDuration 포함
 * CIRCUIT_HALF_OPENED  WARNING  lastOutcome 없음
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.event;
