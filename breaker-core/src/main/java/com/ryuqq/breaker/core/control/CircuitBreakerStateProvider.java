package com.ryuqq.breaker.core.control;

import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.state.CircuitState;

import java.util.Optional;

/**
 * Circuit Breaker 바깥(헬스 체크, 대시보드 등)에서 상태를 읽기 위한 핸들.
 *
 * <p>정확히 하나의 Circuit Breaker에만 연결됩니다. 연결 전에는 CLOSED와 빈 결과를 보고합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerStateProvider {

    private volatile CircuitBreaker breaker;

    /**
     * Circuit Breaker 연결. Circuit Breaker 구현체가 생성 시 호출합니다.
     *
     * @param breaker 연결할 Circuit Breaker
     * @throws IllegalArgumentException breaker가 null인 경우
     * @throws IllegalStateException 이미 다른 Circuit Breaker에 연결된 경우
     */
    public synchronized void attach(CircuitBreaker breaker) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (this.breaker != null) {
            throw new IllegalStateException("CircuitBreakerStateProvider is already attached to a circuit breaker");
        }
        this.breaker = breaker;
    }

    public boolean isAttached() {
        return breaker != null;
    }

    /**
     * 연결된 Circuit Breaker의 현재 상태.
     *
     * @return 현재 상태, 연결 전이면 CLOSED
     */
    public CircuitState circuitState() {
        CircuitBreaker current = breaker;
        return current == null ? CircuitState.CLOSED : current.currentState();
    }

    /**
     * 연결된 Circuit Breaker의 마지막 처리 대상 결과.
     *
     * @return 마지막 결과, 연결 전이거나 없으면 empty
     */
    public Optional<Outcome<?>> lastOutcome() {
        CircuitBreaker current = breaker;
        return current == null ? Optional.empty() : current.lastOutcome();
    }
}
