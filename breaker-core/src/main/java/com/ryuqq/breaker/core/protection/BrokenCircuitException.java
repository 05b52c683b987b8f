package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.state.CircuitState;

import java.time.Duration;
import java.util.Optional;

/**
 * Circuit이 OPEN(또는 프로브가 진행 중인 HALF_OPEN)이어서 차단된 경우.
 *
 * <p>일시적인 차단이며, OPEN에서 차단된 경우 BreakDeadline까지 남은 시간을
 * {@link #getRetryAfter()}로 제공합니다. HALF_OPEN에서 차단된 경우 힌트가 없습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public non-sealed class BrokenCircuitException extends CircuitRejectedException {

    private final Duration retryAfter;

    /**
     * 생성자.
     *
     * @param message 차단 사유
     * @param circuitState 차단 시점 상태
     * @param retryAfter 재시도 가능까지 남은 시간 (null이면 힌트 없음)
     */
    public BrokenCircuitException(String message, CircuitState circuitState, Duration retryAfter) {
        super(message, circuitState);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter cannot be negative (current: " + retryAfter + ")");
        }
        this.retryAfter = retryAfter;
    }

    /**
     * 재시도 힌트.
     *
     * @return BreakDeadline까지 남은 시간, 알 수 없으면 empty
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
