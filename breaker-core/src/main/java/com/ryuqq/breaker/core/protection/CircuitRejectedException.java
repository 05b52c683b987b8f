package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.state.CircuitState;

/**
 * Circuit Breaker가 작업 실행을 차단했을 때 던지는 예외의 상위 타입.
 *
 * <p>작업 자체가 던진 예외는 이 타입으로 래핑되지 않습니다.
 * 이 예외는 Circuit Breaker가 스스로 실행을 막았을 때만 생성됩니다.</p>
 *
 * <p>Circuit Breaker 내부에서 재시도하지 않습니다. 재시도 여부는 호출자가 결정합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public abstract sealed class CircuitRejectedException extends RuntimeException
    permits BrokenCircuitException, IsolatedCircuitException {

    private final CircuitState circuitState;

    protected CircuitRejectedException(String message, CircuitState circuitState) {
        super(message);
        this.circuitState = circuitState;
    }

    /**
     * 차단 시점의 Circuit 상태.
     *
     * @return OPEN, HALF_OPEN 또는 ISOLATED
     */
    public CircuitState getCircuitState() {
        return circuitState;
    }
}
