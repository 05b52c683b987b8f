/**
 * Circuit 상태 머신과 전이 통지.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.engine.state.CircuitStateMachine} - 상태·윈도우·deadline·수동 플래그를 하나의 잠금으로 보호</li>
 *   <li>{@link com.ryuqq.breaker.engine.state.Permit} - 입장 허가 (프로브 여부, 세대)</li>
 *   <li>{@link com.ryuqq.breaker.engine.state.TransitionNotifier} - 잠금 밖에서 순서대로 이벤트 전달</li>
 * </ul>
 *
 * <h2>잠금 규칙</h2>
 * <pre>
 * state lock    : acquire(), onCompletion(), isolate(), close()
 * dispatch lock : 이벤트 전달 (state lock 해제 후)
 * 잠금 없음     : 작업 실행, 분류기, currentState()
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.engine.state;
