package com.ryuqq.breaker.engine.state;

/**
 * 수동 제어 플래그.
 *
 * <p>통계 상태와 직교하는 3상태 플래그이며, {@link CircuitStateMachine}의 잠금 아래에서만 접근합니다.
 * 수동 전이와 자동 전이는 같은 임계 구역에서 직렬화됩니다.</p>
 *
 * <pre>
 * NONE ──isolate()──► ISOLATED
 *  ▲                     │
 *  │                 close()
 *  │                     ▼
 *  └──closeApplied()── CLOSE_PENDING
 * </pre>
 *
 * <p>CLOSE_PENDING은 close()가 요청되었고 카운터 초기화와 CLOSED 전이가 아직 적용되지 않은 상태입니다.
 * 이 상태에서는 격리가 이미 해제된 것으로 봅니다.</p>
 */
final class ManualOverride {

    enum Mode {
        NONE,
        ISOLATED,
        CLOSE_PENDING
    }

    private Mode mode = Mode.NONE;

    Mode mode() {
        return mode;
    }

    boolean isIsolated() {
        return mode == Mode.ISOLATED;
    }

    /**
     * 격리 지시.
     *
     * @return 플래그가 실제로 바뀌었으면 true
     */
    boolean isolate() {
        if (mode == Mode.ISOLATED) {
            return false;
        }
        mode = Mode.ISOLATED;
        return true;
    }

    /**
     * 복구 요청. 격리 여부와 관계없이 CLOSE_PENDING이 됩니다.
     */
    void requestClose() {
        mode = Mode.CLOSE_PENDING;
    }

    /**
     * 복구 적용 완료.
     *
     * @throws IllegalStateException requestClose() 없이 호출된 경우
     */
    void closeApplied() {
        if (mode != Mode.CLOSE_PENDING) {
            throw new IllegalStateException("close was not requested (mode: " + mode + ")");
        }
        mode = Mode.NONE;
    }
}
