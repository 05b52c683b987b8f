package com.ryuqq.breaker.core.state;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (최소 처리량 충족 + 실패율 초과)
 * OPEN (차단)
 *   │
 *   ▼ (BreakDeadline 경과 후 첫 호출)
 * HALF_OPEN (프로브 1건만 통과)
 *   │
 *   ├─► 프로브 성공 → CLOSED
 *   └─► 프로브 실패 → OPEN
 *
 * 모든 상태 ─(isolate)─► ISOLATED ─(close)─► CLOSED
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum CircuitState {

    /**
     * 정상 상태. 통계적으로 요청을 거부하지 않습니다.
     */
    CLOSED,

    /**
     * 차단 상태. BreakDeadline 전까지 모든 요청을 거부합니다.
     */
    OPEN,

    /**
     * 반개방 상태. 단 하나의 프로브 요청만 통과시킵니다.
     */
    HALF_OPEN,

    /**
     * 수동 격리 상태. {@code close()}가 호출될 때까지 무기한 거부합니다.
     */
    ISOLATED;

    /**
     * 통계와 무관하게 항상 차단하는 상태인지 확인.
     *
     * @return ISOLATED인 경우 true
     */
    public boolean isManual() {
        return this == ISOLATED;
    }
}
