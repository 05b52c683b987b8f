package com.ryuqq.breaker.core.event;

import com.ryuqq.breaker.core.protection.PolicyEvaluationException;

/**
 * 상태 전이 관찰자 (텔레메트리 연동 지점).
 *
 * <p>전이를 유발한 호출자의 스레드에서, 호출자에게 제어가 돌아가기 전에 동기적으로 호출됩니다.
 * Circuit Breaker 내부 잠금은 해제된 상태이므로 리스너에서 같은 Circuit Breaker를 호출해도 됩니다.
 * 리스너가 던진 예외는 로그로만 남고 Circuit 상태에 영향을 주지 않습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransitionListener {

    /**
     * 상태 전이 통지.
     *
     * @param event 전이 이벤트
     */
    void onTransition(CircuitTransitionEvent event);

    /**
     * BreakDuration 생성기 실패 통지.
     *
     * <p>기본 구현은 아무것도 하지 않습니다.</p>
     *
     * @param failure 실패 정보 (대체 적용된 duration 포함)
     */
    default void onPolicyEvaluationFailure(PolicyEvaluationException failure) {
        // 기본: 무시
    }
}
